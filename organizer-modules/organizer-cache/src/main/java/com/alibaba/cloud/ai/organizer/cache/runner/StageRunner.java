package com.alibaba.cloud.ai.organizer.cache.runner;

import com.alibaba.cloud.ai.organizer.cache.codec.StageCodec;
import com.alibaba.cloud.ai.organizer.cache.exception.CacheCorruptionException;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.FingerprintComputer;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.IoUnavailableException;
import com.alibaba.cloud.ai.organizer.cache.policy.InvalidationPolicy;
import com.alibaba.cloud.ai.organizer.cache.store.CacheEntry;
import com.alibaba.cloud.ai.organizer.cache.store.CacheKey;
import com.alibaba.cloud.ai.organizer.cache.store.CacheStore;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 缓存感知的阶段执行器 ("计算或读取")
 * 只有这里知道 CacheStore; 阶段本身是不感知缓存的纯函数
 *
 * 两种模式:
 * 1. 整阶段: 主体指纹有效则解码返回, 否则计算、编码、写入
 * 2. 逐项: 每项独立查找缓存, 未命中的逐个计算并立即写入; 单项失败不中断其余项
 *
 * @author RobustH
 */
@Slf4j
@RequiredArgsConstructor
public class StageRunner {

    @Getter
    private final CacheStore cacheStore;
    private final InvalidationPolicy invalidationPolicy;
    private final FingerprintComputer fingerprintComputer;
    @Getter
    private final CacheMode cacheMode;

    // ==================== 整阶段模式 ====================

    /**
     * 执行整阶段缓存的阶段
     *
     * @throws StageComputeException 计算失败 (不写缓存, 下次运行从头重试)
     * @throws com.alibaba.cloud.ai.organizer.cache.exception.CacheWriteException 缓存写入失败
     */
    public <I, O> StageExecution<O> runWholeStage(WholeStageDefinition<I, O> stage, I input) {
        long start = System.nanoTime();
        String stageId = stage.getStageId();
        CacheKey key = CacheKey.global(stageId, stage.getIdentity());
        Fingerprint current = currentFingerprint(key, () -> stage.getSubject().apply(input));

        CacheOutcome outcome = CacheOutcome.BYPASSED;
        if (cacheMode.isReadEnabled()) {
            Optional<O> cached = lookup(key, current, stage.getCodec());
            if (cached.isPresent()) {
                Duration elapsed = elapsedSince(start);
                log.info("[{}] 缓存命中, 跳过计算 ({} ms)", stageId, elapsed.toMillis());
                return new StageExecution<>(stageId, cached.get(), CacheOutcome.HIT, elapsed);
            }
            outcome = CacheOutcome.MISS;
        }

        log.info("[{}] 缓存{}, 开始计算", stageId, outcome == CacheOutcome.MISS ? "未命中" : "已绕过");
        O result = compute(stageId, stage.getCompute(), input);
        store(key, stage.getCodec().encode(result), current);

        Duration elapsed = elapsedSince(start);
        log.info("[{}] 计算完成 ({} ms)", stageId, elapsed.toMillis());
        return new StageExecution<>(stageId, result, outcome, elapsed);
    }

    // ==================== 逐项模式 ====================

    public <T, R> GranularExecution<R> runGranular(GranularStageDefinition<T, R> stage, List<T> items) {
        return runGranular(stage, items, outcome -> { });
    }

    /**
     * 执行逐项缓存的阶段
     * 工作项按ID排序后逐个处理; 每个成功计算的工作项立即写入缓存, 中断后已完成的部分不会丢失
     *
     * @param stage    阶段定义
     * @param items    工作项
     * @param listener 每处理完一项回调一次
     * @throws StageInterruptedException 线程在两个工作项之间被中断
     */
    public <T, R> GranularExecution<R> runGranular(GranularStageDefinition<T, R> stage, List<T> items,
                                                    Consumer<ItemOutcome> listener) {
        long start = System.nanoTime();
        String stageId = stage.getStageId();

        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparing(stage.getItemId()));
        int total = sorted.size();

        // 1. 当前指纹 + 已存储的逐项条目
        List<CacheKey> keys = new ArrayList<>(total);
        List<Fingerprint> currentFingerprints = new ArrayList<>(total);
        Map<CacheKey, CacheEntry> validEntries = new HashMap<>();
        for (T item : sorted) {
            CacheKey key = CacheKey.item(stageId, stage.getItemId().apply(item));
            Fingerprint current = currentFingerprint(key, () -> stage.getItemFingerprint().apply(item));
            keys.add(key);
            currentFingerprints.add(current);
            if (cacheMode.isReadEnabled()) {
                cacheStore.get(key)
                        .filter(entry -> invalidationPolicy.isValid(entry, current))
                        .ifPresent(entry -> validEntries.put(key, entry));
            }
        }

        // 2. 快速路径: 所有逐项条目都有效, 且整阶段条目的指纹与这些条目的聚合一致
        CacheKey aggregateKey = CacheKey.global(stageId, stage.getIdentity());
        if (cacheMode.isReadEnabled() && total > 0 && validEntries.size() == total) {
            List<Fingerprint> stored = new ArrayList<>(total);
            for (CacheKey key : keys) {
                stored.add(validEntries.get(key).getFingerprint());
            }
            Fingerprint aggregate = fingerprintComputer.fingerprintAggregate(stored);
            Optional<List<R>> cached = lookup(aggregateKey, aggregate, stage.getAggregateCodec());
            if (cached.isPresent() && cached.get().size() == total) {
                for (int i = 0; i < total; i++) {
                    listener.accept(new ItemOutcome(keys.get(i).getIdentity(), ItemOutcome.Status.HIT, i + 1, total, null));
                }
                Duration elapsed = elapsedSince(start);
                log.info("[{}] 整阶段快速路径命中: {} 项 ({} ms)", stageId, total, elapsed.toMillis());
                return GranularExecution.<R>builder()
                        .stageId(stageId)
                        .results(List.copyOf(cached.get()))
                        .failures(List.of())
                        .itemHits(total)
                        .itemMisses(0)
                        .fastPath(true)
                        .elapsed(elapsed)
                        .build();
            }
        }

        // 3. 逐项处理
        List<R> results = new ArrayList<>(total);
        List<ItemFailure> failures = new ArrayList<>();
        int hits = 0;
        int misses = 0;
        for (int i = 0; i < total; i++) {
            // 中断标志由调用方设置, 例如命令行的关闭钩子
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[{}] 处理被中断: 已完成 {}/{} 项", stageId, i, total);
                throw new StageInterruptedException(stageId, i, total);
            }

            T item = sorted.get(i);
            CacheKey key = keys.get(i);
            String itemId = key.getIdentity();

            CacheEntry entry = validEntries.get(key);
            if (entry != null) {
                Optional<R> decoded = decode(key, entry, stage.getItemCodec());
                if (decoded.isPresent()) {
                    results.add(decoded.get());
                    hits++;
                    log.debug("[{}] {}/{} 缓存命中: {}", stageId, i + 1, total, itemId);
                    listener.accept(new ItemOutcome(itemId, ItemOutcome.Status.HIT, i + 1, total, null));
                    continue;
                }
            }

            misses++;
            R result;
            try {
                result = stage.getCompute().compute(item);
            } catch (RuntimeException e) {
                String message = describe(e);
                log.error("[{}] {}/{} 计算失败: {}, 原因: {}", stageId, i + 1, total, itemId, message);
                failures.add(new ItemFailure(itemId, message));
                listener.accept(new ItemOutcome(itemId, ItemOutcome.Status.FAILED, i + 1, total, message));
                continue;
            }

            store(key, stage.getItemCodec().encode(result), currentFingerprints.get(i));
            results.add(result);
            log.info("[{}] {}/{} 已计算: {}", stageId, i + 1, total, itemId);
            listener.accept(new ItemOutcome(itemId, ItemOutcome.Status.COMPUTED, i + 1, total, null));
        }

        // 4. 全部成功时写入整阶段快速路径条目
        if (failures.isEmpty() && !currentFingerprints.contains(null)) {
            Fingerprint aggregate = fingerprintComputer.fingerprintAggregate(currentFingerprints);
            store(aggregateKey, stage.getAggregateCodec().encode(results), aggregate);
        } else if (!failures.isEmpty()) {
            log.info("[{}] {} 项失败, 不写入整阶段条目", stageId, failures.size());
        }

        Duration elapsed = elapsedSince(start);
        log.info("[{}] 逐项处理完成: 命中={}, 计算={}, 失败={} ({} ms)",
                stageId, hits, misses - failures.size(), failures.size(), elapsed.toMillis());
        return GranularExecution.<R>builder()
                .stageId(stageId)
                .results(List.copyOf(results))
                .failures(List.copyOf(failures))
                .itemHits(hits)
                .itemMisses(misses)
                .fastPath(false)
                .elapsed(elapsed)
                .build();
    }

    // ==================== 内部方法 ====================

    private Fingerprint currentFingerprint(CacheKey key, Supplier<Fingerprint> subject) {
        try {
            return subject.get();
        } catch (IoUnavailableException e) {
            log.warn("无法计算指纹, 必须重新计算: key={}, 原因={}", key, e.getMessage());
            return null;
        }
    }

    private <T> Optional<T> lookup(CacheKey key, Fingerprint current, StageCodec<T> codec) {
        Optional<CacheEntry> entry = cacheStore.get(key);
        if (entry.isEmpty() || !invalidationPolicy.isValid(entry.get(), current)) {
            return Optional.empty();
        }
        return decode(key, entry.get(), codec);
    }

    private <T> Optional<T> decode(CacheKey key, CacheEntry entry, StageCodec<T> codec) {
        try {
            return Optional.ofNullable(codec.decode(entry.getPayload()));
        } catch (CacheCorruptionException e) {
            log.warn("缓存负载无法解码, 按未命中处理: key={}, 原因={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private <I, O> O compute(String stageId, StageFunction<I, O> function, I input) {
        try {
            return function.compute(input);
        } catch (StageComputeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageComputeException(stageId, describe(e), e);
        }
    }

    private void store(CacheKey key, byte[] payload, Fingerprint fingerprint) {
        if (!cacheMode.isWriteEnabled()) {
            return;
        }
        if (fingerprint == null) {
            log.warn("主体指纹不可用, 跳过缓存写入: key={}", key);
            return;
        }
        // 中断标志会让 FileChannel 写入失败; 写入期间暂时清除, 写完后恢复
        boolean interrupted = Thread.interrupted();
        try {
            cacheStore.put(key, payload, fingerprint);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
