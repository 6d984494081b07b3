package com.platform.paas.worker;

import com.platform.paas.queue.Band;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the per-band worker pools.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "controlplane.workers")
public class WorkerPoolProperties {
    
    /**
     * Interval between autoscale samples in milliseconds.
     */
    private long autoscaleIntervalMs = 5000;
    
    /**
     * How long an idle executor blocks on its band before re-checking for retirement.
     */
    private Duration pollTimeout = Duration.ofSeconds(1);
    
    /**
     * Claims older than this are returned to their band.
     */
    private Duration claimVisibility = Duration.ofMinutes(10);
    
    private BandSettings high = new BandSettings(1, 32);
    
    private BandSettings middle = new BandSettings(1, 16);
    
    private BandSettings low = new BandSettings(1, 8);
    
    public BandSettings forBand(Band band) {
        return switch (band) {
            case HIGH -> high;
            case MIDDLE -> middle;
            case LOW -> low;
        };
    }
    
    /**
     * Concurrency bounds and scaling triggers of one band.
     */
    @Data
    @NoArgsConstructor
    public static class BandSettings {
        
        private int min = 1;
        
        private int max = 8;
        
        /**
         * Ready tasks per live executor above which the band counts as backlogged.
         */
        private int scaleUpThreshold = 2;
        
        /**
         * Consecutive samples a condition must hold before the pool is resized.
         */
        private int sustainSamples = 3;
        
        /**
         * Hard limit on a single task execution.
         */
        private Duration timeout = Duration.ofMinutes(5);
        
        public BandSettings(int min, int max) {
            this.min = min;
            this.max = max;
        }
    }
}
