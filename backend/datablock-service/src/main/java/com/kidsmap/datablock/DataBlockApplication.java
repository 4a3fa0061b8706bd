package com.kidsmap.datablock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * KidsMap Data Block Service Application
 *
 * 장소/콘텐츠 데이터 블록 파이프라인 서비스
 * - 외부 소스(TourAPI, 어린이놀이시설, Kakao, YouTube, Naver)에서 크롤링
 * - 중복 제거 및 품질 등급 산정 후 블록 저장
 * - 크롤링 작업 큐, 최적화, 마이그레이션, 모니터링
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class DataBlockApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataBlockApplication.class, args);
    }
}
