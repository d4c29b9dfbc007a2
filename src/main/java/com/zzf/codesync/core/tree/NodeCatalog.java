package com.zzf.codesync.core.tree;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Known node names: their {@link NodeKind} and which child slot they accept when none is written yet.
 * Qualified names ({@code ListView.builder}) are looked up by their first segment.
 */
public final class NodeCatalog {

    private static final Set<String> DEFAULT_APP = names("MaterialApp", "CupertinoApp", "WidgetsApp");

    private static final Set<String> DEFAULT_LAYOUT = names(
            "Container", "Row", "Column", "Stack", "Positioned", "Align", "Center",
            "Padding", "SizedBox", "Expanded", "Flexible", "Wrap", "ListView",
            "GridView", "CustomScrollView", "SingleChildScrollView", "Card",
            "Scaffold", "AppBar", "Drawer", "BottomNavigationBar", "TabBar", "SafeArea");

    private static final Set<String> DEFAULT_INPUT = names(
            "TextField", "TextFormField", "Checkbox", "Radio", "Switch", "Slider",
            "DropdownButton", "DropdownButtonFormField", "Form", "FormField",
            "GestureDetector", "InkWell", "ElevatedButton", "TextButton", "OutlinedButton",
            "IconButton", "FloatingActionButton");

    private static final Set<String> DEFAULT_DISPLAY = names(
            "Text", "RichText", "Icon", "Image", "CircleAvatar", "Chip", "Divider",
            "LinearProgressIndicator", "CircularProgressIndicator", "Placeholder",
            "Spacer", "Opacity", "ListTile");

    private static final Set<String> DEFAULT_MULTI_CHILD = names(
            "Row", "Column", "Stack", "Wrap", "ListView", "GridView", "Flow");

    private static final Set<String> DEFAULT_SINGLE_CHILD = names(
            "Container", "Center", "Padding", "Align", "SizedBox", "Expanded", "Flexible",
            "Card", "SafeArea", "SingleChildScrollView", "Positioned", "Opacity",
            "GestureDetector", "InkWell", "ElevatedButton", "TextButton", "OutlinedButton",
            "FloatingActionButton");

    private final Set<String> app;
    private final Set<String> layout;
    private final Set<String> input;
    private final Set<String> display;
    private final Set<String> multiChild;
    private final Set<String> singleChild;

    public NodeCatalog(
            Collection<String> app,
            Collection<String> layout,
            Collection<String> input,
            Collection<String> display,
            Collection<String> multiChild,
            Collection<String> singleChild
    ) {
        this.app = copy(app);
        this.layout = copy(layout);
        this.input = copy(input);
        this.display = copy(display);
        this.multiChild = copy(multiChild);
        this.singleChild = copy(singleChild);
    }

    public static NodeCatalog defaults() {
        return new NodeCatalog(DEFAULT_APP, DEFAULT_LAYOUT, DEFAULT_INPUT, DEFAULT_DISPLAY,
                DEFAULT_MULTI_CHILD, DEFAULT_SINGLE_CHILD);
    }

    public NodeKind classify(String name) {
        if (UiTreeNode.ROOT_NAME.equals(name)) {
            return NodeKind.ROOT;
        }
        String base = baseName(name);
        if (app.contains(base)) {
            return NodeKind.APP;
        }
        if (layout.contains(base)) {
            return NodeKind.LAYOUT;
        }
        if (input.contains(base)) {
            return NodeKind.INPUT;
        }
        if (display.contains(base)) {
            return NodeKind.DISPLAY;
        }
        return NodeKind.COMPONENT;
    }

    public boolean acceptsChildren(String name) {
        return multiChild.contains(baseName(name));
    }

    public boolean acceptsChild(String name) {
        return singleChild.contains(baseName(name));
    }

    private static String baseName(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    private static Set<String> names(String... values) {
        return Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(values)));
    }

    private static Set<String> copy(Collection<String> values) {
        if (values == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<String>(values));
    }

    public Set<String> getApp() {
        return app;
    }

    public Set<String> getLayout() {
        return layout;
    }

    public Set<String> getInput() {
        return input;
    }

    public Set<String> getDisplay() {
        return display;
    }

    public Set<String> getMultiChild() {
        return multiChild;
    }

    public Set<String> getSingleChild() {
        return singleChild;
    }
}
