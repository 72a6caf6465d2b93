package io.github.chirino.speakercache.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import jakarta.enterprise.inject.Instance;
import java.lang.annotation.Annotation;

/** Mockito backed {@link Instance} stand-ins for beans that select collaborators lazily. */
public final class MockInstances {

    private MockInstances() {}

    @SuppressWarnings("unchecked")
    public static <T> Instance<T> of(T value) {
        Instance<T> instance = mock(Instance.class);
        lenient().when(instance.get()).thenReturn(value);
        lenient().when(instance.isUnsatisfied()).thenReturn(false);
        lenient().when(instance.isResolvable()).thenReturn(true);
        lenient().when(instance.select(any(Annotation[].class))).thenReturn(instance);
        return instance;
    }

    @SuppressWarnings("unchecked")
    public static <T> Instance<T> unsatisfied() {
        Instance<T> instance = mock(Instance.class);
        lenient()
                .when(instance.get())
                .thenThrow(new IllegalStateException("Unsatisfied instance"));
        lenient().when(instance.isUnsatisfied()).thenReturn(true);
        lenient().when(instance.isResolvable()).thenReturn(false);
        lenient().when(instance.select(any(Annotation[].class))).thenReturn(instance);
        return instance;
    }
}
