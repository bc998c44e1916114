package de.caluga.dataapi.events;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event emitter with an optional parent. Events emitted here are passed on to the parent
 * (client &lt;- db &lt;- collection) unless a listener stops propagation.
 */
public class HierarchicalEmitter {
    private final HierarchicalEmitter parent;
    private final Map<DataApiEventType, List<DataApiEventListener>> listeners = new ConcurrentHashMap<>();

    public HierarchicalEmitter(HierarchicalEmitter parent) {
        this.parent = parent;
    }

    public HierarchicalEmitter getParent() {
        return parent;
    }

    public DataApiEventListener on(DataApiEventType type, DataApiEventListener listener) {
        listeners.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(listener);
        return listener;
    }

    public DataApiEventListener once(DataApiEventType type, DataApiEventListener listener) {
        DataApiEventListener[] wrapper = new DataApiEventListener[1];
        wrapper[0] = evt -> {
            off(type, wrapper[0]);
            listener.onEvent(evt);
        };
        return on(type, wrapper[0]);
    }

    public void off(DataApiEventType type, DataApiEventListener listener) {
        List<DataApiEventListener> l = listeners.get(type);
        if (l != null) l.remove(listener);
    }

    public void removeAllListeners() {
        listeners.clear();
    }

    public void removeAllListeners(DataApiEventType type) {
        listeners.remove(type);
    }

    public int listenerCount(DataApiEventType type) {
        List<DataApiEventListener> l = listeners.get(type);
        return l == null ? 0 : l.size();
    }

    /**
     * calls all local listeners in registration order, then bubbles to the parent
     *
     * @return true if at least one listener was called anywhere in the hierarchy
     */
    public boolean emit(DataApiEventType type, DataApiEvent event) {
        boolean called = false;
        List<DataApiEventListener> l = listeners.get(type);

        if (l != null) {
            for (DataApiEventListener listener : l) {
                called = true;
                listener.onEvent(event);

                if (event.getPropagationState() == DataApiEvent.PropagationState.STOP_IMMEDIATE) {
                    return true;
                }
            }
        }

        if (event.getPropagationState() == DataApiEvent.PropagationState.STOP || parent == null) {
            return called;
        }

        return parent.emit(type, event) || called;
    }
}
