package net.schedora.core.service;

/**
 * dayOfMonth 가 대상 월에 없을 때 (예: 2월 31일) 처리 방식.
 */
public enum MonthlyOverflowPolicy {
    /** 그 달의 마지막 날로 당김 */
    CLAMP,
    /** 그 달은 건너뛰고 interval 단위로 다음 유효 월을 찾음 */
    SKIP
}
