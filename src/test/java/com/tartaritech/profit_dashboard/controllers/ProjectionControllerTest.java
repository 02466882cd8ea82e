package com.tartaritech.profit_dashboard.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpSession;

import com.tartaritech.profit_dashboard.dtos.BaseMonthRequestDTO;
import com.tartaritech.profit_dashboard.dtos.MonthlySummaryDTO;
import com.tartaritech.profit_dashboard.dtos.MultiplierRequestDTO;
import com.tartaritech.profit_dashboard.dtos.ProjectionStateDTO;
import com.tartaritech.profit_dashboard.enums.MetricSource;
import com.tartaritech.profit_dashboard.services.ProjectionEngine;
import com.tartaritech.profit_dashboard.services.ProjectionService;

class ProjectionControllerTest {

    private ProjectionEngine seededEngine() {
        MonthlySummaryDTO feb = new MonthlySummaryDTO();
        feb.setMonth("2024-02");
        feb.setRevenue(new BigDecimal("1000.00"));
        feb.getSources().add(MetricSource.SHOPIFY);
        ProjectionEngine engine = new ProjectionEngine(List.of(new BigDecimal("2")), 1);
        engine.initProjection(List.of(feb), YearMonth.of(2024, 3), 10);
        return engine;
    }

    @Test
    void getProjection_beforeInitIsConflict() {
        ProjectionController controller = new ProjectionController(mock(ProjectionService.class));

        ResponseEntity<Object> res = controller.getProjection(new MockHttpSession());

        assertEquals(409, res.getStatusCode().value());
    }

    @Test
    void init_storesEngineInSession() {
        ProjectionService service = mock(ProjectionService.class);
        ProjectionEngine engine = seededEngine();
        when(service.createProjection(180)).thenReturn(engine);
        ProjectionController controller = new ProjectionController(service);
        MockHttpSession session = new MockHttpSession();

        ResponseEntity<Object> res = controller.init(180, session);

        assertEquals(200, res.getStatusCode().value());
        assertEquals(engine, session.getAttribute(ProjectionController.SESSION_ATTRIBUTE));
        assertInstanceOf(ProjectionStateDTO.class, res.getBody());
    }

    @Test
    void setMultiplier_updatesSessionState() {
        ProjectionController controller = new ProjectionController(mock(ProjectionService.class));
        MockHttpSession session = new MockHttpSession();
        session.setAttribute(ProjectionController.SESSION_ATTRIBUTE, seededEngine());

        ResponseEntity<Object> res = controller.setMultiplier(1, new MultiplierRequestDTO(3.0), session);

        assertEquals(200, res.getStatusCode().value());
        ProjectionStateDTO state = (ProjectionStateDTO) res.getBody();
        assertEquals(new BigDecimal("3000.00"), state.getRows().get(1).getProjectedRevenue());
    }

    @Test
    void setBaseMonth_outOfRangeIsBadRequest() {
        ProjectionController controller = new ProjectionController(mock(ProjectionService.class));
        MockHttpSession session = new MockHttpSession();
        session.setAttribute(ProjectionController.SESSION_ATTRIBUTE, seededEngine());

        ResponseEntity<Object> res = controller.setBaseMonth(new BaseMonthRequestDTO(5), session);

        assertEquals(400, res.getStatusCode().value());
    }
}
