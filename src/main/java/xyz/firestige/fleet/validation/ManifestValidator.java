package xyz.firestige.fleet.validation;

import xyz.firestige.fleet.domain.manifest.Manifest;

/**
 * 清单校验器接口
 * <p>
 * 实现必须容忍部分绑定的清单（字段可能为 null），因为所有校验器在同一轮中执行并汇总错误
 */
public interface ManifestValidator {

    /**
     * 校验清单
     *
     * @param manifest 已绑定的清单
     * @return 校验结果
     */
    ValidationResult validate(Manifest manifest);

    /**
     * 获取校验器名称
     */
    String getValidatorName();

    /**
     * 获取执行顺序，数字越小越先执行
     */
    default int getOrder() {
        return 100;
    }
}
