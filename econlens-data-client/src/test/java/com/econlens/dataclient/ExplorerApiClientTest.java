package com.econlens.dataclient;

import com.econlens.core.catalog.CatalogDimensions;
import com.econlens.core.catalog.IdentifierCatalog;
import com.econlens.core.model.CatalogPage;
import com.econlens.core.model.CatalogQuery;
import com.econlens.core.model.DimensionOption;
import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;
import com.econlens.core.model.Periodicity;
import com.econlens.core.model.SeriesInfo;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExplorerApiClient against an in-process backend.
 */
class ExplorerApiClientTest {

    private static final String SERIES_JSON = """
        {"total": 3, "limit": 2, "offset": 0, "series": [
          {"series_id": "CUSR0000SA0", "series_title": "All items in U.S. city average",
           "area_code": "0000", "area_name": "U.S. city average",
           "item_code": "SA0", "item_name": "All items",
           "seasonal_code": "S", "periodicity_code": "R",
           "begin_year": 1947, "end_year": 2024, "is_active": true},
          {"series_title": "entry without id"},
          {"series_id": "CUUR0000SA0", "series_title": "All items, not adjusted",
           "area_code": "0000", "item_code": "SA0", "seasonal_code": "U", "periodicity_code": "R",
           "is_active": false}
        ]}
        """;

    private static final String BLS_DATA_JSON = """
        {"series": [{"series_id": "CUSR0000SA0", "data_points": [
          {"year": 2024, "period": "M02", "period_name": "February 2024", "value": 310.3},
          {"year": 2024, "period": "M01", "period_name": "January 2024", "value": "309.7"},
          {"year": 2023, "period": "M13", "period_name": "Annual 2023", "value": 304.7},
          {"year": 2023, "period": "M12", "period_name": "December 2023", "value": null},
          {"year": 2023, "period": "XX", "value": 1.0},
          {"year": 2023, "period": "M14", "value": 1.0},
          {"period": "M11", "value": 1.0}
        ]}]}
        """;

    private static final String BEA_DATA_JSON = """
        {"series_code": "A191RL", "unit": "Percent change", "data": [
          {"time_period": "2023Q4", "value": 3.4},
          {"time_period": "2024Q1", "value": 1.6},
          {"time_period": "2024", "value": 2.8},
          {"time_period": "bad", "value": 1.0}
        ]}
        """;

    private static final String DIMENSIONS_JSON = """
        {"areas": [
          {"area_code": "0000", "area_name": "U.S. city average", "display_level": 0, "selectable": true, "sort_sequence": 1},
          {"area_code": "0100", "area_name": "Northeast", "display_level": 1, "selectable": true, "sort_sequence": 2}
        ],
         "items": [
          {"item_code": "SA0", "item_name": "All items", "display_level": 0, "selectable": true, "sort_sequence": 1},
          {"item_code": "SAF", "item_name": "Food and beverages", "display_level": 1, "selectable": false, "sort_sequence": 2}
        ],
         "note": "not a dimension"}
        """;

    private Javalin app;
    private final Map<String, String> lastRequest = new ConcurrentHashMap<>();

    @BeforeEach
    void startBackend() {
        app = Javalin.create(config -> config.showJavalinBanner = false);
        app.get("/health", ctx -> ctx.result("ok"));
        app.get("/api/research/bls/cu/series", ctx -> {
            lastRequest.clear();
            ctx.queryParamMap().forEach((k, v) -> lastRequest.put(k, v.get(0)));
            String auth = ctx.header("Authorization");
            if (auth != null) lastRequest.put("auth", auth);
            ctx.contentType("application/json").result(SERIES_JSON);
        });
        app.get("/api/research/bls/cu/dimensions", ctx -> ctx.contentType("application/json").result(DIMENSIONS_JSON));
        app.get("/api/research/bls/cu/series/{id}/data", ctx -> {
            if (!ctx.pathParam("id").equals("CUSR0000SA0")) {
                ctx.status(404).result("{\"detail\": \"Series not found\"}");
                return;
            }
            lastRequest.clear();
            ctx.queryParamMap().forEach((k, v) -> lastRequest.put(k, v.get(0)));
            ctx.contentType("application/json").result(BLS_DATA_JSON);
        });
        app.get("/api/research/bea/nipa/series/{id}/data", ctx -> ctx.contentType("application/json").result(BEA_DATA_JSON));
        app.get("/api/research/bls/broken/series", ctx -> ctx.status(500).result("database unavailable"));
        app.start(0);
    }

    @AfterEach
    void stopBackend() {
        app.stop();
    }

    private ExplorerApiClient client() {
        return new ExplorerApiClient(new ExplorerClientConfig("http://localhost:" + app.port() + "/"));
    }

    @Nested
    @DisplayName("Catalog")
    class CatalogTests {

        @Test
        @DisplayName("Series list maps to catalog entries, skipping entries without id")
        void listSeries() throws IOException {
            // When
            CatalogPage page = client().listSeries("bls", "cu",
                new CatalogQuery("all items", Map.of("area", "0000"), 0, 2, true));

            // Then
            assertEquals(3, page.total());
            assertEquals(2, page.items().size());
            SeriesInfo first = page.items().get(0);
            assertEquals("CUSR0000SA0", first.id());
            assertEquals("0000", first.dimension("area"));
            assertEquals("U.S. city average", first.dimensionNames().get("area"));
            assertEquals(Periodicity.MONTHLY, first.periodicity());
            assertTrue(first.seasonallyAdjusted());
            assertEquals(1947, first.beginYear());
            assertFalse(page.items().get(1).active());
            assertTrue(page.hasMore());
        }

        @Test
        @DisplayName("Query parameters carry keyword, paging and filters")
        void queryParameters() throws IOException {
            client().listSeries("bls", "cu", new CatalogQuery("bread", Map.of("item", "SEFA"), 20, 50, true));

            assertEquals("bread", lastRequest.get("search"));
            assertEquals("SEFA", lastRequest.get("item_code"));
            assertEquals("20", lastRequest.get("offset"));
            assertEquals("50", lastRequest.get("limit"));
            assertEquals("true", lastRequest.get("active_only"));
            assertNull(lastRequest.get("auth"), "No token configured");
        }

        @Test
        @DisplayName("Bearer token is sent when configured")
        void bearerToken() throws IOException {
            ExplorerApiClient authed = new ExplorerApiClient(
                new ExplorerClientConfig("http://localhost:" + app.port(), "secret", 5, 5));

            authed.listSeries("bls", "cu", new CatalogQuery(null, Map.of(), 0, 10, true));

            assertEquals("Bearer secret", lastRequest.get("auth"));
        }

        @Test
        @DisplayName("Dimensions are named after their code fields")
        void dimensions() throws IOException {
            CatalogDimensions dims = client().getDimensions("bls", "cu");

            assertEquals(List.of("area", "item"), List.copyOf(dims.names()));
            assertEquals(List.of("0100"), dims.childrenOf("area", "0000").stream().map(DimensionOption::code).toList());
            assertEquals(List.of("SA0"), dims.selectable("item").stream().map(DimensionOption::code).toList());
        }

        @Test
        @DisplayName("Server errors become error pages in the catalog")
        void serverError() {
            IdentifierCatalog catalog = new IdentifierCatalog(new RemoteCatalogFetcher(client(), "bls", "broken"));

            CatalogPage page = catalog.search("x", 10);

            assertTrue(page.isError());
            assertTrue(page.error().contains("500"));
        }
    }

    @Nested
    @DisplayName("Series data")
    class SeriesDataTests {

        @Test
        @DisplayName("BLS data points become observations, unreadable points are skipped")
        void blsData() throws IOException {
            List<Observation> obs = client().getSeriesData("bls", "cu", "CUSR0000SA0", PeriodKey.month(2023, 1));

            assertEquals(4, obs.size());
            assertEquals("2023", lastRequest.get("start_year"));

            Observation feb = obs.get(0);
            assertEquals(PeriodKey.month(2024, 2), feb.periodKey());
            assertEquals("February 2024", feb.label());
            assertEquals(310.3, feb.value());
            assertEquals(309.7, obs.get(1).value(), "Numeric strings are accepted");
            assertTrue(obs.get(2).periodKey().isAnnualAverage());
            assertFalse(obs.get(3).hasValue());
        }

        @Test
        @DisplayName("BEA time periods are parsed")
        void beaData() throws IOException {
            List<Observation> obs = new RemoteSeriesFetcher(client(), "bea", "nipa").fetch("A191RL", null);

            assertEquals(List.of(PeriodKey.quarter(2023, 4), PeriodKey.quarter(2024, 1), PeriodKey.annual(2024)),
                obs.stream().map(Observation::periodKey).toList());
        }

        @Test
        @DisplayName("Unknown series raises an exception carrying the status")
        void notFound() {
            ExplorerApiException e = assertThrows(ExplorerApiException.class,
                () -> client().getSeriesData("bls", "cu", "NOPE", null));

            assertEquals(404, e.getStatusCode());
            assertTrue(e.isNotFound());
            assertTrue(e.getResponseBody().contains("Series not found"));
        }
    }

    @Test
    @DisplayName("Health check reflects reachability")
    void health() {
        assertTrue(client().isHealthy());
        assertFalse(new ExplorerApiClient(new ExplorerClientConfig("http://localhost:1")).isHealthy());
    }

    @Test
    @DisplayName("Config rejects blank URLs and strips the trailing slash")
    void config() {
        assertThrows(IllegalArgumentException.class, () -> new ExplorerClientConfig(" "));
        assertEquals("http://example.org", new ExplorerClientConfig("http://example.org/").getBaseUrl());
        assertNull(new ExplorerClientConfig("http://example.org", "  ", 1, 1).getApiToken());
    }

    @Test
    @DisplayName("Write timeout is configured separately from the connect timeout")
    void writeTimeout() {
        ExplorerClientConfig config = new ExplorerClientConfig("http://example.org", null, 5, 60, 45);
        ExplorerApiClient client = new ExplorerApiClient(config);

        assertEquals(45, client.getConfig().getWriteTimeoutSeconds());
        assertEquals(30, new ExplorerClientConfig("http://example.org").getWriteTimeoutSeconds());
        assertEquals(45_000, client.getHttpClient().writeTimeoutMillis());
        assertEquals(5_000, client.getHttpClient().connectTimeoutMillis());
        assertThrows(IllegalArgumentException.class, () -> new ExplorerClientConfig("http://example.org", null, 5, 60, 0));
    }
}
