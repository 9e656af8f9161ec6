package fr.lapetina.vpn.selector.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates evaluation slots in the Disruptor ring buffer.
 */
public final class EvaluationEventFactory implements EventFactory<EvaluationEvent> {

    @Override
    public EvaluationEvent newInstance() {
        EvaluationEvent event = new EvaluationEvent();
        event.clear();
        return event;
    }
}
