package com.tether;

import java.util.regex.Pattern;

/**
 * Derives the short host context name the core uses to pick host-specific behaviour.
 */
public final class HostContextName {
    
    private static final Pattern FLAVOUR = Pattern.compile("\\b(Autodesk |Structure |MEP |Architecture )\\b");
    
    private HostContextName() {
    }
    
    /**
     * Strips product flavour words from the host version name.
     * 
     * @param versionName e.g. "Autodesk Revit Architecture 2015"
     * @return e.g. "Revit 2015"
     */
    public static String fromVersionName(String versionName) {
        if (versionName == null || versionName.isBlank()) {
            throw new IllegalArgumentException("Host version name cannot be null or empty");
        }
        
        String context = FLAVOUR.matcher(versionName).replaceAll("");
        
        // Vasari dropped the year from its version name
        if (context.equals("Vasari")) {
            context = "Vasari 2014";
        }
        return context;
    }
}
