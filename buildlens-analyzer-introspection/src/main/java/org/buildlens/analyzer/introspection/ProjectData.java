package org.buildlens.analyzer.introspection;

import java.util.ArrayList;
import java.util.List;

/**
 * @param descriptiveName the name declared in <code>project()</code>
 * @param version         the declared version, <code>undefined</code> when not a string
 * @param name            the directory name, for sub-projects only
 * @param subprojects     the sub-projects that could be analysed, for the top-level project only
 */
public record ProjectData(String descriptiveName, String version, String name, List<ProjectData> subprojects) {

    public ProjectData {
        subprojects = List.copyOf(subprojects);
    }

    public ProjectData withName(String name) {
        return new ProjectData(descriptiveName, version, name, subprojects);
    }

    public ProjectData withSubproject(ProjectData subproject) {
        List<ProjectData> list = new ArrayList<>(subprojects);
        list.add(subproject);
        return new ProjectData(descriptiveName, version, name, list);
    }
}
