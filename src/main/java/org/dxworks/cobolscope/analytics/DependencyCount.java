package org.dxworks.cobolscope.analytics;

public class DependencyCount {
    public String name;
    public int count;

    public DependencyCount() {
    }

    public DependencyCount(String name, int count) {
        this.name = name;
        this.count = count;
    }
}
