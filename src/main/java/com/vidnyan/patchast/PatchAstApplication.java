package com.vidnyan.patchast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * patch-ast - aligns Python syntax trees with their source text.
 */
@SpringBootApplication
public class PatchAstApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatchAstApplication.class, args);
    }
}
