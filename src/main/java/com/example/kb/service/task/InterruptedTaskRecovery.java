package com.example.kb.service.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 启动时回收上次运行中断的文档
 *
 * 处理线程随进程退出, 遗留的 pending/processing 文档不会再有人推进,
 * 这里统一标记为失败, 用户可以重新处理或删除。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterruptedTaskRecovery {

    private final TaskTracker taskTracker;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        int recovered = taskTracker.recoverInterrupted();
        if (recovered > 0) {
            log.warn("启动恢复: {} 个文档的处理被中断, 已标记为失败", recovered);
        } else {
            log.info("启动恢复: 没有中断的文档");
        }
    }
}
