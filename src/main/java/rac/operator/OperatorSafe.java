package rac.operator;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorProxy;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;
import rac.util.UnsignalledExceptions;

/**
 * Turns the exceptions thrown while delivering a value downstream, contract
 * violations included, into an error event.
 * <p>
 * The output type is left undeclared so a typed actor subscribed after this
 * operator is checked per value, inside the guarded delivery.
 *
 * @param <T> the value type
 */
final class OperatorSafe<T> implements Operator<T, T>, ActorProxy<T, T> {

    @Override
    public Observable<T> apply(Observable<T> source) {
        return ProxyObservable.ofActor(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super T> downstream) {
        return new SafeActor<>(downstream);
    }

    static final class SafeActor<T> extends ProxyActor<T, T> {

        SafeActor(Actor<? super T> actual) {
            super(actual);
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }
            try {
                actual.onNext(t);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                done = true;
                disposeUpstream();
                try {
                    actual.onError(e);
                } catch (VirtualMachineError ex) {
                    throw ex;
                } catch (Throwable ex) {
                    UnsignalledExceptions.onErrorDropped(ex, e);
                }
            }
        }

        @Override
        public void onError(Throwable e) {
            try {
                super.onError(e);
            } catch (VirtualMachineError ex) {
                throw ex;
            } catch (Throwable ex) {
                UnsignalledExceptions.onErrorDropped(ex, e);
            }
        }

        @Override
        public void onComplete() {
            try {
                super.onComplete();
            } catch (VirtualMachineError ex) {
                throw ex;
            } catch (Throwable ex) {
                UnsignalledExceptions.onErrorDropped(ex);
            }
        }
    }
}
