package com.zzf.codesync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "codesync.sync")
public class SyncConfig {
    private int maxUndoDepth = 100;

    public int getMaxUndoDepth() {
        return maxUndoDepth;
    }

    public void setMaxUndoDepth(int maxUndoDepth) {
        this.maxUndoDepth = maxUndoDepth;
    }
}
