package com.zzf.codesync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Node name sets. A set left unset keeps the built-in names.
 */
@Configuration
@ConfigurationProperties(prefix = "codesync.catalog")
public class CatalogConfig {
    private List<String> app;
    private List<String> layout;
    private List<String> input;
    private List<String> display;
    private List<String> multiChild;
    private List<String> singleChild;

    public List<String> getApp() {
        return app;
    }

    public void setApp(List<String> app) {
        this.app = app;
    }

    public List<String> getLayout() {
        return layout;
    }

    public void setLayout(List<String> layout) {
        this.layout = layout;
    }

    public List<String> getInput() {
        return input;
    }

    public void setInput(List<String> input) {
        this.input = input;
    }

    public List<String> getDisplay() {
        return display;
    }

    public void setDisplay(List<String> display) {
        this.display = display;
    }

    public List<String> getMultiChild() {
        return multiChild;
    }

    public void setMultiChild(List<String> multiChild) {
        this.multiChild = multiChild;
    }

    public List<String> getSingleChild() {
        return singleChild;
    }

    public void setSingleChild(List<String> singleChild) {
        this.singleChild = singleChild;
    }
}
