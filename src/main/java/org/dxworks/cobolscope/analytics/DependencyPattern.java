package org.dxworks.cobolscope.analytics;

import java.util.ArrayList;
import java.util.List;

public class DependencyPattern {
    public List<String> pattern = new ArrayList<>();
    public List<String> programs = new ArrayList<>();
}
