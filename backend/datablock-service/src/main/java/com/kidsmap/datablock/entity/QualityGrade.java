package com.kidsmap.datablock.entity;

/**
 * 데이터 품질 등급 (A가 최상).
 * score 는 모니터링 평균 품질 점수 계산에 사용된다.
 */
public enum QualityGrade {
    A(5),
    B(4),
    C(3),
    D(2),
    F(1);

    private final int score;

    QualityGrade(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    /**
     * 이 등급이 기준 등급보다 나쁜지 여부
     */
    public boolean isWorseThan(QualityGrade threshold) {
        return this.ordinal() > threshold.ordinal();
    }
}
