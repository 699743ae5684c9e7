package org.nowstart.tseval.algorithm;

import jakarta.annotation.PostConstruct;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tseval.data.exception.DuplicateAlgorithmException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlgorithmRegistry {

    private final ObjectProvider<AlgorithmDescriptor> descriptorBeans;
    private volatile Map<String, AlgorithmDescriptor> descriptorsByName = Map.of();

    @PostConstruct
    public void init() {
        descriptorBeans.orderedStream().forEach(this::register);
        log.info("event=algorithms_registered count={} names={}", descriptorsByName.size(), descriptorsByName.keySet());
    }

    public synchronized void register(AlgorithmDescriptor descriptor) {
        Map<String, AlgorithmDescriptor> next = new LinkedHashMap<>(descriptorsByName);
        if (next.putIfAbsent(descriptor.name(), descriptor) != null) {
            throw new DuplicateAlgorithmException(descriptor.name());
        }
        descriptorsByName = Collections.unmodifiableMap(next);
    }

    public AlgorithmDescriptor getRequired(String name) {
        AlgorithmDescriptor descriptor = name == null ? null : descriptorsByName.get(name.trim());
        if (descriptor == null) {
            throw new IllegalStateException("No algorithm registered for name=" + name);
        }
        return descriptor;
    }

    public List<AlgorithmDescriptor> all() {
        return List.copyOf(descriptorsByName.values());
    }

    public boolean isEmpty() {
        return descriptorsByName.isEmpty();
    }
}
