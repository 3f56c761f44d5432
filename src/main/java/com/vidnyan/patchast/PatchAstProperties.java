package com.vidnyan.patchast;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for parsing and patching.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "patchast")
public class PatchAstProperties {

    /**
     * Interpreter that runs the AST dump script.
     * Default: python3 on the PATH
     */
    private String pythonExecutable = "python3";

    /**
     * Classpath location of the AST dump script.
     */
    private String dumpScript = "python/dump_ast.py";

    /**
     * Longest time one parse may take before the interpreter is killed.
     */
    private Duration parseTimeout = Duration.ofSeconds(30);

    /**
     * Record sorted children on every node.
     */
    private boolean collectChildren = false;

    /**
     * Filename reported in syntax errors when the caller gives none.
     */
    private String defaultFilename = "<string>";
}
