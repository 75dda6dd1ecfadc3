/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.concise.core;

import io.concise.output.LogContext;
import org.slf4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish/subscribe bus between the engine and reporters. Listeners for an event type are
 * called synchronously, in registration order.
 */
public class EventDispatcher {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Map<RunEventType, List<RunListener>> listeners = new EnumMap<>(RunEventType.class);

    public EventDispatcher() {
        for (RunEventType type : RunEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public EventDispatcher listen(RunEventType type, RunListener listener) {
        listeners.get(type).add(listener);
        return this;
    }

    /**
     * Register a listener for every event type.
     */
    public EventDispatcher listenAll(RunListener listener) {
        for (RunEventType type : RunEventType.values()) {
            listen(type, listener);
        }
        return this;
    }

    /**
     * A listener that throws is logged and does not prevent the remaining listeners, or the
     * run, from proceeding.
     */
    public void dispatch(RunEvent event) {
        for (RunListener listener : listeners.get(event.getType())) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("listener failed on {}: {}", event.getType().getEventName(), e.getMessage(), e);
            }
        }
    }

}
