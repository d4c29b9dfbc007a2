package com.zzf.codesync.config;

import com.zzf.codesync.core.edit.StructuralEditor;
import com.zzf.codesync.core.tree.NodeCatalog;
import com.zzf.codesync.core.tree.UiTreeParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;

@Slf4j
@Configuration
public class CodeSyncConfiguration {

    @Bean
    public NodeCatalog nodeCatalog(CatalogConfig config) {
        NodeCatalog defaults = NodeCatalog.defaults();
        NodeCatalog catalog = new NodeCatalog(
                orDefault(config.getApp(), defaults.getApp()),
                orDefault(config.getLayout(), defaults.getLayout()),
                orDefault(config.getInput(), defaults.getInput()),
                orDefault(config.getDisplay(), defaults.getDisplay()),
                orDefault(config.getMultiChild(), defaults.getMultiChild()),
                orDefault(config.getSingleChild(), defaults.getSingleChild()));
        log.info("catalog.loaded layout={} multiChild={} singleChild={}",
                catalog.getLayout().size(), catalog.getMultiChild().size(), catalog.getSingleChild().size());
        return catalog;
    }

    @Bean
    public UiTreeParser uiTreeParser(NodeCatalog catalog) {
        return new UiTreeParser(catalog);
    }

    @Bean
    public StructuralEditor structuralEditor(UiTreeParser parser, EditorConfig config) {
        return new StructuralEditor(parser, config.getIndentUnit(), config.getMultiChildSlot(), config.getSingleChildSlot());
    }

    private static Collection<String> orDefault(Collection<String> configured, Collection<String> fallback) {
        return configured == null ? fallback : configured;
    }
}
