package xyz.firestige.fleet.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.fleet.domain.manifest.Manifest;
import xyz.firestige.fleet.support.TestManifests;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValidationChain 单元测试
 */
@Tag("unit")
@DisplayName("ValidationChain 单元测试")
class ValidationChainTest {

    private final Manifest manifest = TestManifests.bindOnly(TestManifests.FRESH_DEPLOY);

    @Test
    @DisplayName("场景 2.1: 校验器按 order 排序执行")
    void runsValidatorsInOrder() {
        // Given
        List<String> executed = new ArrayList<>();
        ValidationChain chain = new ValidationChain()
                .addValidator(recording("late", 50, executed, false))
                .addValidator(recording("early", 10, executed, false));

        // When
        ValidationResult result = chain.validate(manifest);

        // Then
        assertTrue(result.isValid());
        assertEquals(List.of("early", "late"), executed);
        assertEquals(List.of("early", "late"), chain.getValidatorNames());
    }

    @Test
    @DisplayName("场景 2.2: 默认收集全部校验器的错误")
    void collectsAllErrors() {
        List<String> executed = new ArrayList<>();
        ValidationChain chain = new ValidationChain()
                .addValidator(recording("first", 10, executed, true))
                .addValidator(recording("second", 20, executed, true));

        ValidationResult result = chain.validate(manifest);

        assertFalse(result.isValid());
        assertEquals(2, result.getErrors().size());
        assertEquals(List.of("first", "second"), executed);
    }

    @Test
    @DisplayName("场景 2.3: 快速失败模式遇到第一个错误即停止")
    void failFastStopsAtFirstError() {
        List<String> executed = new ArrayList<>();
        ValidationChain chain = new ValidationChain(true)
                .addValidator(recording("first", 10, executed, true))
                .addValidator(recording("second", 20, executed, true));

        ValidationResult result = chain.validate(manifest);

        assertEquals(1, result.getErrors().size());
        assertEquals(List.of("first"), executed);
        assertTrue(chain.isFailFast());
    }

    private static ManifestValidator recording(String name, int order, List<String> executed, boolean fail) {
        return new ManifestValidator() {
            @Override
            public ValidationResult validate(Manifest manifest) {
                executed.add(name);
                return fail
                        ? ValidationResult.failure(ValidationError.of(name, name + " 失败", "TEST"))
                        : ValidationResult.success();
            }

            @Override
            public String getValidatorName() {
                return name;
            }

            @Override
            public int getOrder() {
                return order;
            }
        };
    }
}
