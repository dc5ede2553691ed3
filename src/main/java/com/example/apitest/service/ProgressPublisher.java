package com.example.apitest.service;

import com.example.apitest.model.ProgressEvent;

/**
 * Transport for live progress events. Implementations deliver one already stamped and size
 * limited event at a time.
 */
public interface ProgressPublisher {
    void publish(ProgressEvent event);
}
