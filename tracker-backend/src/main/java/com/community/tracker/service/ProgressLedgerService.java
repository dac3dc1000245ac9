package com.community.tracker.service;

import com.community.tracker.client.CatalogSnapshot;
import com.community.tracker.dto.ObservationResultDTO;
import com.community.tracker.dto.ProgressRecordDTO;
import com.community.tracker.scope.ScopeToken;

import java.util.List;

public interface ProgressLedgerService {

    /**
     * 用快照计算一个已选用挑战的进度，高于已存值时写入。
     * 不高于已存值时返回 STALE_WRITE，不视为错误。
     */
    ObservationResultDTO recordObservation(ScopeToken token, String definitionKey, CatalogSnapshot snapshot);

    /**
     * 按选用顺序对令牌社区的每个挑战执行 {@link #recordObservation}
     */
    List<ObservationResultDTO> recordObservations(ScopeToken token, CatalogSnapshot snapshot);

    List<ProgressRecordDTO> getProgress(ScopeToken token);

    /**
     * 赛季重置：只重置令牌社区中的一个挑战
     *
     * @return 被重置的记录数
     */
    int resetProgress(ScopeToken token, String definitionKey);

    int removePersonProgress(ScopeToken token, Long personId);
}
