package fr.lapetina.xplorer.dispatch;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link DispatchEvent} slots for the ring buffer.
 */
public final class DispatchEventFactory implements EventFactory<DispatchEvent> {

    @Override
    public DispatchEvent newInstance() {
        return new DispatchEvent();
    }
}
