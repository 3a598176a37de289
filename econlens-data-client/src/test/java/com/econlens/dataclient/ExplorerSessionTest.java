package com.econlens.dataclient;

import com.econlens.core.context.ComparisonSnapshot;
import com.econlens.core.context.ExplorerSettings;
import com.econlens.core.model.CatalogPage;
import com.econlens.core.model.PeriodKey;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test: catalog search, selection and comparison over HTTP.
 */
class ExplorerSessionTest {

    private Javalin app;

    @BeforeEach
    void startBackend() {
        app = Javalin.create(config -> config.showJavalinBanner = false);
        app.get("/api/research/bls/cu/series", ctx -> ctx.contentType("application/json").result("""
            {"total": 2, "limit": 10, "offset": 0, "series": [
              {"series_id": "A", "series_title": "All items", "is_active": true},
              {"series_id": "B", "series_title": "Core", "is_active": true}
            ]}
            """));
        app.get("/api/research/bls/cu/series/A/data", ctx -> ctx.contentType("application/json").result("""
            {"series": [{"data_points": [
              {"year": 2023, "period": "M01", "value": 100.0},
              {"year": 2023, "period": "M02", "value": 102.0},
              {"year": 2022, "period": "M13", "value": 98.0}
            ]}]}
            """));
        app.get("/api/research/bls/cu/series/B/data", ctx -> ctx.contentType("application/json").result("""
            {"series": [{"data_points": [
              {"year": 2023, "period": "M02", "value": 50.0},
              {"year": 2023, "period": "M03", "value": 51.0}
            ]}]}
            """));
        app.start(0);
    }

    @AfterEach
    void stopBackend() {
        app.stop();
    }

    @Test
    @DisplayName("Selected series are fetched, aligned and compared")
    void compare() {
        // Given
        ExplorerApiClient client = new ExplorerApiClient(new ExplorerClientConfig("http://localhost:" + app.port()));
        ExplorerSettings settings = ExplorerSettings.builder("cu").capacity(5).build();
        ExplorerSession session = new ExplorerSession(client, settings, Runnable::run, null);

        // When
        CatalogPage page = session.getCatalog().search("", 10);
        page.items().forEach(info -> session.getContext().toggle(info.id()));
        ComparisonSnapshot snap = session.getContext().snapshot();

        // Then
        assertEquals(List.of("A", "B"), snap.seriesIds());
        assertEquals(3, snap.rows().size(), "Annual average is dropped");
        assertEquals(PeriodKey.month(2023, 3), snap.activePeriod().orElseThrow());
        assertEquals(51.0, snap.metric("B").latest());
        assertEquals(2.0, snap.metric("B").periodChangePct(), 1e-9);
        assertFalse(snap.metric("A").hasLatest());

        session.close();
    }
}
