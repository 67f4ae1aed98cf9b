package rac.actor;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rac.flow.Actor;

/**
 * An actor that logs every event at info level, prefixed by its name.
 *
 * @param <T> the value type
 */
public final class LoggerActor<T> implements Actor<T> {

    private static final Logger LOG = LoggerFactory.getLogger(LoggerActor.class);

    final String name;

    public LoggerActor(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public void onNext(T t) {
        LOG.info("[{}] Data: {}", name, t);
    }

    @Override
    public void onError(Throwable e) {
        LOG.info("[{}] Error: {}", name, e.toString());
    }

    @Override
    public void onComplete() {
        LOG.info("[{}] Completed", name);
    }

    @Override
    public String toString() {
        return "LoggerActor(" + name + ")";
    }
}
