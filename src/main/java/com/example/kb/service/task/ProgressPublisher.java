package com.example.kb.service.task;

import com.example.kb.dto.ProgressEvent;

/**
 * 进度事件发布接口, 由入库流程显式注入, 与通知投递方式解耦
 */
public interface ProgressPublisher {

    void publish(ProgressEvent event);
}
