package com.lidar.repository.data.impl;

import com.lidar.repository.data.SeedSource;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class WfsSeedReaderTest {

    @Test
    void testGetFeatureQuery() {
        SeedSource source = SeedSource.wfs("https://idena.navarra.es/ogc/wfs", "IDENA:LIDAR_Vuelo", "IDENA");

        URI uri = WfsSeedReader.getFeatureUri(source);

        String query = uri.getRawQuery();
        assertTrue(query.contains("service=WFS"));
        assertTrue(query.contains("request=GetFeature"));
        assertTrue(query.contains("typeName=IDENA%3ALIDAR_Vuelo"));
        assertTrue(query.contains("outputFormat=application%2Fjson"));
        assertTrue(query.contains("srsName=EPSG%3A4326"));
        assertFalse(query.contains("bbox"));
    }

    @Test
    void testBboxAndExistingQueryString() {
        SeedSource source = SeedSource.wfs("https://example.org/geoserver/ows?map=lidar", "lidar:tiles", "PNOA");
        source.setBbox("-1.7,42.8,-1.6,42.9");

        URI uri = WfsSeedReader.getFeatureUri(source);

        assertTrue(uri.toString().startsWith("https://example.org/geoserver/ows?map=lidar&service=WFS"));
        assertTrue(uri.getRawQuery().contains("bbox=-1.7%2C42.8%2C-1.6%2C42.9"));
    }
}
