package com.zzf.codesync.config;

import com.zzf.codesync.core.edit.StructuralEditor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "codesync.editor")
public class EditorConfig {
    private String indentUnit = StructuralEditor.DEFAULT_INDENT_UNIT;
    private String multiChildSlot = StructuralEditor.DEFAULT_MULTI_CHILD_SLOT;
    private String singleChildSlot = StructuralEditor.DEFAULT_SINGLE_CHILD_SLOT;

    public String getIndentUnit() {
        return indentUnit;
    }

    public void setIndentUnit(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public String getMultiChildSlot() {
        return multiChildSlot;
    }

    public void setMultiChildSlot(String multiChildSlot) {
        this.multiChildSlot = multiChildSlot;
    }

    public String getSingleChildSlot() {
        return singleChildSlot;
    }

    public void setSingleChildSlot(String singleChildSlot) {
        this.singleChildSlot = singleChildSlot;
    }
}
