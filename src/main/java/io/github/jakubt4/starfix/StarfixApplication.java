package io.github.jakubt4.starfix;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Starfix: plate-solving service for star-tracker and telescope pointing.
 *
 * <p>Accepts detected star centroids, matches them against a star-pattern database through a
 * shared solver engine, and returns the celestial orientation of the image. Also converts
 * between image pixels and sky coordinates for a known orientation.
 *
 * @see io.github.jakubt4.starfix.service.PlateSolverService
 * @see io.github.jakubt4.starfix.controller.PlateSolverController
 */
@SpringBootApplication
@EnableRetry
public class StarfixApplication {

    public static void main(String[] args) {
        SpringApplication.run(StarfixApplication.class, args);
    }
}
