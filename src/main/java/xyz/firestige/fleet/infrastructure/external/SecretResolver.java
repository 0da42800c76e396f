package xyz.firestige.fleet.infrastructure.external;

/**
 * 凭据解析
 * <p>
 * 解析结果只在调用外部协作方时使用，不落盘、不打印
 */
public interface SecretResolver {

    /**
     * 解析凭据引用
     *
     * @throws xyz.firestige.fleet.exception.FatalApplyException 无法解析时
     */
    String resolve(String reference);

    boolean canResolve(String reference);
}
