package xyz.firestige.fleet.domain.manifest;

/**
 * 容器资源规格
 *
 * @param cores    CPU 核数
 * @param memoryMb 内存（MB）
 * @param diskGb   磁盘（GB）
 */
public record ResourceSizing(Integer cores, Integer memoryMb, Integer diskGb) {

    public static final ResourceSizing UNSPECIFIED = new ResourceSizing(null, null, null);
}
