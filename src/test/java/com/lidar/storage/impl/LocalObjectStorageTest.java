package com.lidar.storage.impl;

import com.lidar.storage.ContentTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalObjectStorageTest {

    @TempDir
    Path tempDir;

    private LocalObjectStorage storage;

    @BeforeEach
    void setUp() {
        storage = new LocalObjectStorage(tempDir.resolve("store"));
    }

    @Test
    void testPutGetRoundTrip() throws Exception {
        Path source = Files.writeString(tempDir.resolve("a.laz"), "points");

        storage.putFile("tiles", "a.laz", source, "application/vnd.laszip");
        Path copy = storage.getFile("tiles", "a.laz", tempDir.resolve("work/a.laz"));

        assertEquals("points", Files.readString(copy));
        assertTrue(storage.exists("tiles", "a.laz"));
        assertFalse(storage.exists("tiles", "b.laz"));
    }

    @Test
    void testMissingObject() {
        assertThrows(FileNotFoundException.class,
            () -> storage.getFile("tiles", "nope.laz", tempDir.resolve("nope.laz")));
    }

    @Test
    void testUploadDirectoryAndDeletePrefix() throws Exception {
        // Given
        Path tiles = Files.createDirectories(tempDir.resolve("tiles/r"));
        Files.writeString(tempDir.resolve("tiles/tileset.json"), "{}");
        Files.writeString(tiles.resolve("r0.pnts"), "pnts");

        // When
        int uploaded = storage.uploadDirectory("tilesets", "tilesets/job-1", tempDir.resolve("tiles"));

        // Then
        assertEquals(2, uploaded);
        assertTrue(storage.exists("tilesets", "tilesets/job-1/tileset.json"));
        assertTrue(storage.exists("tilesets", "tilesets/job-1/r/r0.pnts"));
        assertTrue(storage.publicUrl("tilesets", "tilesets/job-1/tileset.json").endsWith("tilesets/job-1/tileset.json"));

        assertEquals(2, storage.deletePrefix("tilesets", "tilesets/job-1"));
        assertFalse(storage.exists("tilesets", "tilesets/job-1/tileset.json"));
    }

    @Test
    void testKeyCannotEscapeBucket() {
        assertThrows(IllegalArgumentException.class, () -> storage.exists("tiles", "../other/secret"));
    }

    @Test
    void testContentTypes() {
        assertEquals("application/json", ContentTypes.forFileName("tileset.json"));
        assertEquals("model/gltf-binary", ContentTypes.forFileName("mesh.GLB"));
        assertEquals(ContentTypes.DEFAULT, ContentTypes.forFileName("r0.pnts"));
        assertEquals(ContentTypes.DEFAULT, ContentTypes.forFileName("README"));
    }
}
