package xyz.firestige.fleet.infrastructure.health;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutingProbeRunnerTest {

    private final List<String> http = new ArrayList<>();
    private final List<String> commands = new ArrayList<>();

    private final RoutingProbeRunner runner = new RoutingProbeRunner(
            (target, timeout) -> {
                http.add(target);
                return ProbeResult.ok();
            },
            (target, timeout) -> {
                commands.add(target);
                return ProbeResult.ok();
            });

    @Test
    void testHttpTargetsGoToHttpRunner() {
        runner.run("http://10.0.0.5:3000/api/health", Duration.ofSeconds(1));
        runner.run(" HTTPS://grafana.example.com/ ", Duration.ofSeconds(1));

        assertEquals(List.of("http://10.0.0.5:3000/api/health", "HTTPS://grafana.example.com/"), http);
        assertTrue(commands.isEmpty());
    }

    @Test
    void testEverythingElseIsACommand() {
        runner.run("pg_isready -h 10.0.0.10", Duration.ofSeconds(1));

        assertEquals(List.of("pg_isready -h 10.0.0.10"), commands);
        assertTrue(http.isEmpty());
    }
}
