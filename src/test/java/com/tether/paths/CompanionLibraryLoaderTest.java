package com.tether.paths;

import com.tether.config.TetherConfig;
import com.tether.lifecycle.InitializationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.junit.jupiter.api.Assertions.*;

class CompanionLibraryLoaderTest {
    
    @TempDir
    Path tempDir;
    
    private CompanionLibraryLoader loader;
    
    @BeforeEach
    void setUp() {
        loader = new CompanionLibraryLoader();
    }
    
    private void writeEmptyJar(Path jar) throws Exception {
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().putValue("Manifest-Version", "1.0");
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream jarOut = new JarOutputStream(out, manifest)) {
            jarOut.flush();
        }
    }
    
    @Test
    void testMissingLibraryFails() {
        InitializationException e = assertThrows(InitializationException.class,
            () -> loader.resolveGeometryFactoryPath(tempDir, TetherConfig.defaults()));
        assertTrue(e.getMessage().contains("geometry-manager.jar"));
    }
    
    @Test
    void testResolvesThroughRegisteredLocator() throws Exception {
        writeEmptyJar(tempDir.resolve("geometry-manager.jar"));
        
        Path factory = loader.resolveGeometryFactoryPath(tempDir, TetherConfig.defaults());
        
        assertEquals(tempDir.resolve("geometry-220.jar"), factory);
    }
    
    @Test
    void testRequestedVersionPassedToLocator() throws Exception {
        writeEmptyJar(tempDir.resolve("shapes.jar"));
        TetherConfig config = new TetherConfig("nodes", List.of(), "shapes.jar", 221, true, "workspacePath");
        
        Path factory = loader.resolveGeometryFactoryPath(tempDir, config);
        
        assertEquals(tempDir.resolve("geometry-221.jar"), factory);
    }
    
    @Test
    void testLocatorFailureBecomesInitializationException() throws Exception {
        writeEmptyJar(tempDir.resolve("geometry-manager.jar"));
        TetherConfig config = new TetherConfig("nodes", List.of(), "geometry-manager.jar", 0, true, "workspacePath");
        
        InitializationException e = assertThrows(InitializationException.class,
            () -> loader.resolveGeometryFactoryPath(tempDir, config));
        
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
