package com.apiflow.config;

import com.apiflow.exception.ApiFlowException;
import com.apiflow.model.CallDescriptor;
import com.apiflow.model.CallResult;
import com.apiflow.service.api.CallBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Executes a single call descriptor on startup, when {@code apiflow.run.descriptor} points at a
 * JSON file, and prints every returned row as one line of JSON.
 * <p>
 * The file holds a serialized {@link CallDescriptor}, for example:
 * <pre>
 * {"serviceId": "bigquery", "version": "v2", "auth": "user", "method": "datasets.list",
 *  "arguments": {"projectId": "my-project"}, "iterate": true}
 * </pre>
 */
@Component
@Profile("!test") // Ensures this does not run during tests
@Slf4j
public class DescriptorRunner implements CommandLineRunner {

    private final CallBuilder callBuilder;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper;

    public DescriptorRunner(CallBuilder callBuilder, EngineProperties properties, ObjectMapper objectMapper) {
        this.callBuilder = callBuilder;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) {
        String path = properties.getRun().getDescriptor();
        if (path == null || path.isBlank()) {
            log.debug("No call descriptor configured. Skipping.");
            return;
        }
        File file = new File(path);
        if (!file.isFile()) {
            throw new ApiFlowException("Call descriptor not found at '" + path + "'");
        }

        CallDescriptor descriptor;
        try {
            descriptor = objectMapper.readValue(file, CallDescriptor.class);
        } catch (IOException e) {
            throw new ApiFlowException("Failed to read call descriptor from '" + path + "'", e);
        }

        log.info("Running {}.{}.{}", descriptor.getServiceId(), descriptor.getVersion(), descriptor.getMethod());
        CallResult result = callBuilder.call(descriptor);
        long rows = 0;
        for (Iterator<JsonNode> it = result.stream().iterator(); it.hasNext(); ) {
            System.out.println(it.next().toString());
            rows++;
        }
        log.info("Call returned {} row(s).", rows);
    }
}
