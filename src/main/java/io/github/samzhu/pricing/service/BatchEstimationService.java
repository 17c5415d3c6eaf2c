package io.github.samzhu.pricing.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.pricing.dto.EstimateCommand;
import io.github.samzhu.pricing.dto.EstimateResult;
import io.github.samzhu.pricing.exception.ErrorCode;
import io.github.samzhu.pricing.exception.PricingException;

/**
 * 批次估價服務。
 *
 * <p>每個項目獨立估價，可平行執行：
 * <ul>
 *   <li>回傳結果保持輸入順序</li>
 *   <li>單一項目的 {@link PricingException} 只記錄為該項目的錯誤</li>
 *   <li>非預期錯誤轉為 {@link ErrorCode#INTERNAL_ERROR}，不揭露內部訊息，也不影響其他項目</li>
 * </ul>
 */
@Service
public class BatchEstimationService {

    private static final Logger log = LoggerFactory.getLogger(BatchEstimationService.class);

    private final CostEstimationService estimationService;
    private final Executor executor;

    public BatchEstimationService(CostEstimationService estimationService,
                                  @Qualifier("estimationExecutor") Executor executor) {
        this.estimationService = estimationService;
        this.executor = executor;
    }

    /**
     * 估算一批用量。
     *
     * @param commands 估價輸入
     * @return 每個項目的結果，順序與輸入相同
     */
    public List<BatchOutcome> estimateAll(List<EstimateCommand> commands) {
        long startTime = System.currentTimeMillis();

        List<CompletableFuture<BatchOutcome>> futures = new ArrayList<>(commands.size());
        for (int i = 0; i < commands.size(); i++) {
            int index = i;
            EstimateCommand command = commands.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> estimateOne(index, command), executor));
        }

        List<BatchOutcome> outcomes = futures.stream()
            .map(CompletableFuture::join)
            .toList();

        long failed = outcomes.stream().filter(BatchOutcome::isFailure).count();
        log.info("Batch estimate completed: items={}, failed={}, {}ms",
            outcomes.size(), failed, System.currentTimeMillis() - startTime);
        return outcomes;
    }

    private BatchOutcome estimateOne(int index, EstimateCommand command) {
        try {
            return BatchOutcome.success(index, estimationService.estimate(command));
        } catch (PricingException e) {
            log.debug("Batch item {} failed: code={}, message={}", index, e.getCode(), e.getMessage());
            return BatchOutcome.failure(index, e);
        } catch (RuntimeException e) {
            log.error("Batch item {} failed unexpectedly: provider={}, model={}",
                index, command.provider(), command.model(), e);
            return BatchOutcome.failure(index,
                new PricingException(ErrorCode.INTERNAL_ERROR, "Internal server error"));
        }
    }

    /**
     * 單一項目的估價結果，{@code result} 與 {@code error} 恰有一個非 null。
     *
     * @param index 項目在批次中的位置（從 0 開始）
     * @param result 成功時的估價結果
     * @param error 失敗時的錯誤
     */
    public record BatchOutcome(
        int index,
        EstimateResult result,
        PricingException error
    ) {
        public static BatchOutcome success(int index, EstimateResult result) {
            return new BatchOutcome(index, result, null);
        }

        public static BatchOutcome failure(int index, PricingException error) {
            return new BatchOutcome(index, null, error);
        }

        public boolean isFailure() {
            return error != null;
        }
    }
}
