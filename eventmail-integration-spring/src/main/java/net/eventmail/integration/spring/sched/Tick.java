package net.eventmail.integration.spring.sched;

/** 한 번의 틱. 예외는 루프가 로그로 남긴다 */
@FunctionalInterface
public interface Tick {
    void run() throws Exception;
}
