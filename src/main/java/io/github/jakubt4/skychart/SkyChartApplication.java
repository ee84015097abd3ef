package io.github.jakubt4.skychart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Skychart — all-sky camera for a fixed observer.
 *
 * <p>Computes the horizontal positions of the Sun, Moon and planets with Orekit,
 * draws them with the solstice and today's Sun tracks and optional constellation
 * figures on a polar chart, and serves the periodically refreshed frame over HTTP.
 *
 * @see io.github.jakubt4.skychart.sky.Sky
 * @see io.github.jakubt4.skychart.service.SkyCameraService
 */
@SpringBootApplication
@EnableScheduling
public class SkyChartApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkyChartApplication.class, args);
    }
}
