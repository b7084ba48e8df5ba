package com.detour.service;

import com.detour.config.DetourProperties;
import com.detour.interceptor.InterceptionContext;
import com.detour.interceptor.InterceptorException;
import com.detour.interceptor.RequestInterceptor;
import com.detour.interceptor.ResponseInterceptor;
import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered request and response interceptor chains.
 *
 * <p>Interceptors run strictly in registration order; each sees the output of
 * the previous one. Removal compares by identity, so the handle passed to
 * {@code add*} is the one that must be passed to {@code remove*}.
 */
@Slf4j
@Service
public class InterceptorPipeline {

    private final List<RequestInterceptor> requestInterceptors = new ArrayList<>();
    private final List<ResponseInterceptor> responseInterceptors = new ArrayList<>();
    private final boolean requestTransformEnabled;
    private final boolean responseTransformEnabled;

    public InterceptorPipeline(DetourProperties properties) {
        this.requestTransformEnabled = properties.getIntercept().isRequestTransform();
        this.responseTransformEnabled = properties.getIntercept().isResponseTransform();
    }

    public synchronized void addRequestInterceptor(RequestInterceptor interceptor) {
        requestInterceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
        log.info("Registered request interceptor '{}' at position {}",
                interceptor.getName(), requestInterceptors.size());
    }

    public synchronized void addResponseInterceptor(ResponseInterceptor interceptor) {
        responseInterceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
        log.info("Registered response interceptor '{}' at position {}",
                interceptor.getName(), responseInterceptors.size());
    }

    /**
     * Remove the first registration of exactly this instance.
     *
     * @return true if it was registered
     */
    public synchronized boolean removeRequestInterceptor(RequestInterceptor interceptor) {
        int index = indexOfIdentity(requestInterceptors, interceptor);
        if (index < 0) {
            return false;
        }
        requestInterceptors.remove(index);
        log.info("Removed request interceptor '{}'", interceptor.getName());
        return true;
    }

    public synchronized boolean removeResponseInterceptor(ResponseInterceptor interceptor) {
        int index = indexOfIdentity(responseInterceptors, interceptor);
        if (index < 0) {
            return false;
        }
        responseInterceptors.remove(index);
        log.info("Removed response interceptor '{}'", interceptor.getName());
        return true;
    }

    public synchronized List<RequestInterceptor> getRequestInterceptors() {
        return List.copyOf(requestInterceptors);
    }

    public synchronized List<ResponseInterceptor> getResponseInterceptors() {
        return List.copyOf(responseInterceptors);
    }

    /**
     * Run the request chain. The chain is snapshotted first, so registrations
     * made while a dispatch is running only affect later dispatches.
     *
     * @throws InterceptorException wrapping the first interceptor failure
     */
    public RequestDescriptor applyRequest(RequestDescriptor request, InterceptionContext context) {
        if (!requestTransformEnabled) {
            return request;
        }
        RequestDescriptor current = request;
        for (RequestInterceptor interceptor : getRequestInterceptors()) {
            RequestDescriptor next;
            try {
                next = interceptor.intercept(current, context.withRequest(current));
            } catch (RuntimeException e) {
                throw new InterceptorException(interceptor.getName(), InterceptorException.Phase.REQUEST, e);
            }
            if (next != null) {
                current = next;
            }
        }
        return current;
    }

    /**
     * Run the response chain.
     *
     * @throws InterceptorException wrapping the first interceptor failure
     */
    public ResponseDescriptor applyResponse(ResponseDescriptor response, InterceptionContext context) {
        if (!responseTransformEnabled) {
            return response;
        }
        ResponseDescriptor current = response;
        for (ResponseInterceptor interceptor : getResponseInterceptors()) {
            ResponseDescriptor next;
            try {
                next = interceptor.intercept(current, context);
            } catch (RuntimeException e) {
                throw new InterceptorException(interceptor.getName(), InterceptorException.Phase.RESPONSE, e);
            }
            if (next != null) {
                current = next;
            }
        }
        return current;
    }

    private static <T> int indexOfIdentity(List<T> list, T target) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == target) {
                return i;
            }
        }
        return -1;
    }
}
