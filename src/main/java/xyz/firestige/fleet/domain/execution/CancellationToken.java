package xyz.firestige.fleet.domain.execution;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 取消令牌
 * <p>
 * 取消后不再启动新的工作项，正在进行的外部调用照常完成；等待中的重试间隔和健康检查会被唤醒
 */
public class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel(String why) {
        if (reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            latch.countDown();
            callbacks.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * 注册取消回调；已取消时立即执行
     */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * 可被取消打断的等待
     *
     * @return true 表示等待期间被取消
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
