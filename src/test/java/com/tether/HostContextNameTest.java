package com.tether;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class HostContextNameTest {
    
    @ParameterizedTest
    @CsvSource({
        "Autodesk Revit Architecture 2015, Revit 2015",
        "Autodesk Revit Structure 2014, Revit 2014",
        "Autodesk Revit MEP 2014, Revit 2014",
        "Autodesk Revit 2015, Revit 2015",
        "Autodesk Vasari, Vasari 2014"
    })
    void testFlavourWordsStripped(String versionName, String expected) {
        assertEquals(expected, HostContextName.fromVersionName(versionName));
    }
    
    @Test
    void testVasariGetsYear() {
        assertEquals("Vasari 2014", HostContextName.fromVersionName("Vasari"));
    }
    
    @Test
    void testBlankRejected() {
        assertThrows(IllegalArgumentException.class, () -> HostContextName.fromVersionName(" "));
        assertThrows(IllegalArgumentException.class, () -> HostContextName.fromVersionName(null));
    }
}
