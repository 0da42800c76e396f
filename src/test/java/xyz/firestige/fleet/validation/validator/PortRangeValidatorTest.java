package xyz.firestige.fleet.validation.validator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.fleet.support.TestManifests;
import xyz.firestige.fleet.validation.ValidationError;
import xyz.firestige.fleet.validation.ValidationResult;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@DisplayName("PortRangeValidator 单元测试")
class PortRangeValidatorTest {

    @Test
    @DisplayName("场景 3.9: 服务端口与数据库端口越界")
    void reportsOutOfRangePorts() {
        String yaml = TestManifests.NETWORK + """
                core_services:
                  postgresql:
                    ip: 10.0.0.10
                    hostname: postgresql
                    ports: [5432, 65535, 65536, -1]
                    interface:
                      db:
                        database: app
                        port: 99999
                """;

        ValidationResult result = new PortRangeValidator().validate(TestManifests.bindOnly(yaml));

        List<String> fields = result.getErrors().stream().map(ValidationError::getField).collect(Collectors.toList());
        assertEquals(List.of(
                "core_services.postgresql.ports[2]",
                "core_services.postgresql.ports[3]",
                "core_services.postgresql.interface.db.port"), fields);
    }
}
