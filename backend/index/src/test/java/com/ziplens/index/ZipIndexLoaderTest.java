package com.ziplens.index;

import com.ziplens.core.model.ZipRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZipIndexLoaderTest {
    @Test
    void loadsJsonArrayOfRecords() throws Exception {
        ZipIndex index = new ZipIndex();
        String json = """
                [
                  {"zip":"10001","lat":40.75,"lng":-73.99,"city":"New York","state_id":"NY","county_fips":"36061",
                   "county_name":"New York","population":27613,"density":34606.4,"timezone":"America/New_York","zcta":true},
                  {"zip":"601","lat":"18.18","lng":"-66.75","city":"Adjuntas","state_id":"PR","population":"17242","zcta":"TRUE"}
                ]
                """;

        LoadReport report = ZipIndexLoader.loadJson(index, stream(json));

        assertEquals(2, report.accepted());
        ZipRecord manhattan = index.get("10001").orElseThrow();
        assertEquals(34606.4, manhattan.density());
        assertEquals("36061", manhattan.countyFips());
        ZipRecord adjuntas = index.get("00601").orElseThrow();
        assertEquals(18.18, adjuntas.lat());
        assertEquals(17242, adjuntas.population());
        assertTrue(adjuntas.zcta());
        assertNull(adjuntas.countyFips());
    }

    @Test
    void loadsJsonObjectKeyedByZip() throws Exception {
        ZipIndex index = new ZipIndex();
        String json = """
                {
                  "02108": {"lat":42.357,"lng":-71.064,"city":"Boston","state_id":"MA"},
                  "02109": {"zip":"02109","lat":42.36,"lng":-71.05,"city":"Boston","state_id":"MA"},
                  "bad": 5
                }
                """;

        LoadReport report = ZipIndexLoader.loadJson(index, stream(json));

        assertEquals(2, report.accepted());
        assertEquals(1, report.rejected());
        assertEquals("bad", report.rejections().get(0).source());
        assertEquals(2, index.byCity("boston", "MA", 10).size());
    }

    @Test
    void loadsCsvWithQuotedFieldsAndRejectsBadRows() throws Exception {
        ZipIndex index = new ZipIndex();
        String csv = """
                "zip","lat","lng","city","state_id","county_fips","county_name","population","density","timezone","zcta"
                "501","40.81","-73.04","Holtsville","NY","36103","Suffolk","0","0","America/New_York","FALSE"
                "10001","40.75","-73.99","New York","NY","36061","New York, County","27613","34606.4","America/New_York","TRUE"
                "99999","","","Nowhere","NY","36000","Nowhere","0","0","America/New_York","TRUE"
                "10002","40.71","-73.98","New York"
                """;

        LoadReport report = ZipIndexLoader.loadCsv(index, new StringReader(csv));

        assertEquals(2, report.accepted());
        assertEquals(2, report.rejected());
        assertEquals("line 4", report.rejections().get(0).source());
        assertTrue(report.rejections().get(1).reason().startsWith("Field count mismatch"));
        assertEquals("New York, County", index.get("10001").orElseThrow().countyName());
        assertTrue(index.get("10001").orElseThrow().zcta());
        assertFalse(index.get("00501").orElseThrow().zcta());
    }

    @Test
    void rejectionLabelsPointAtTheOriginalArrayPosition() throws Exception {
        ZipIndex index = new ZipIndex();
        String json = """
                [
                  "not a record",
                  {"zip":"10001","lat":40.75,"lng":-73.99,"state_id":"NY"},
                  {"lat":40.71,"lng":-73.98,"state_id":"NY"}
                ]
                """;

        LoadReport report = ZipIndexLoader.loadJson(index, stream(json));

        assertEquals(1, report.accepted());
        List<String> sources = report.rejections().stream().map(LoadReport.Rejection::source).toList();
        assertTrue(sources.contains("#1"), sources.toString());
        assertTrue(sources.contains("#3"), sources.toString());
        assertFalse(sources.contains("#2"), sources.toString());
    }

    @Test
    void splitCsvHandlesEmptyAndEscapedFields() {
        assertEquals(List.of("a", "", "b"), ZipIndexLoader.splitCsv("a,,b"));
        assertEquals(List.of("say \"hi\"", "x"), ZipIndexLoader.splitCsv("\"say \"\"hi\"\"\",x"));
    }

    @Test
    void loadPicksFormatFromExtension() throws Exception {
        Path dir = Files.createTempDirectory("zip-index-loader-");
        Path csv = dir.resolve("zips.csv");
        Files.writeString(csv, "zip,lat,lng,city,state_id\n10001,40.75,-73.99,New York,NY\n");
        Path json = dir.resolve("zips.json");
        Files.writeString(json, "[{\"zip\":\"02108\",\"lat\":42.35,\"lng\":-71.06,\"state_id\":\"MA\"}]");

        ZipIndex index = new ZipIndex();
        ZipIndexLoader.load(index, csv);
        ZipIndexLoader.load(index, json);

        assertEquals(2, index.stats().totalRecords());
    }

    @Test
    void missingFileFailsWithPathInMessage() throws Exception {
        Path missing = Files.createTempDirectory("zip-index-missing-").resolve("nope.json");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> ZipIndexLoader.load(new ZipIndex(), missing));
        assertTrue(error.getMessage().contains("nope.json"));
    }

    private static ByteArrayInputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
