package com.lidar.storage;

import java.util.Locale;
import java.util.Map;

/**
 * Content types of 3D Tiles payloads, by file extension
 */
public final class ContentTypes {

    public static final String DEFAULT = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.of(
            "json", "application/json",
            "pnts", "application/octet-stream",
            "b3dm", "application/octet-stream",
            "i3dm", "application/octet-stream",
            "cmpt", "application/octet-stream",
            "glb", "model/gltf-binary",
            "gltf", "model/gltf+json",
            "laz", "application/vnd.laszip",
            "las", "application/vnd.las");

    private ContentTypes() {
    }

    public static String forFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT;
        }
        return BY_EXTENSION.getOrDefault(fileName.substring(dot + 1).toLowerCase(Locale.ROOT), DEFAULT);
    }
}
