package com.kidsmap.datablock.dto.crawl;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 큐 상태 요약. session* 값은 프로세스 기동 이후 누적치이다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {

    /** 지금 실행 가능한 PENDING */
    private long waiting;

    /** 재시도 백오프 중인 PENDING */
    private long delayed;

    private long active;

    private long completed;

    private long failed;

    private long cancelled;

    private long paused;

    private long sessionDispatched;

    private long sessionCompleted;

    private long sessionFailed;
}
