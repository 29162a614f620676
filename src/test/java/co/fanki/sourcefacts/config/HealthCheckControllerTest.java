package co.fanki.sourcefacts.config;

import co.fanki.sourcefacts.analysis.domain.python.InterpreterLocator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link HealthCheckController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class HealthCheckControllerTest {

    private InterpreterLocator interpreterLocator;

    private HealthCheckController controller;

    @BeforeEach
    void setUp() {
        interpreterLocator = createMock(InterpreterLocator.class);
        controller = new HealthCheckController(interpreterLocator);
    }

    @Test
    void whenCheckingHealth_shouldReturnOk() {
        replay(interpreterLocator);

        final ResponseEntity<String> response = controller.health();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("ok", response.getBody());
    }

    @Test
    void whenCheckingReadiness_givenInterpreter_shouldReportAvailable() {
        expect(interpreterLocator.isAvailable()).andReturn(true);
        expect(interpreterLocator.candidates()).andReturn(List.of("python3"));
        replay(interpreterLocator);

        final ResponseEntity<Map<String, Object>> response = controller.ready();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("ready", response.getBody().get("status"));
        assertEquals("available", response.getBody().get("python"));
        verify(interpreterLocator);
    }

    @Test
    void whenCheckingReadiness_givenNoInterpreter_shouldStayReady() {
        expect(interpreterLocator.isAvailable()).andReturn(false);
        expect(interpreterLocator.candidates())
                .andReturn(List.of("python3", "python"));
        replay(interpreterLocator);

        final ResponseEntity<Map<String, Object>> response = controller.ready();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("unavailable", response.getBody().get("python"));
        assertEquals(List.of("python3", "python"),
                response.getBody().get("pythonCandidates"));
        verify(interpreterLocator);
    }

}
