package com.narraflow.narraflow_backend.catalog;

import com.narraflow.narraflow_backend.config.CatalogProperties;
import com.narraflow.narraflow_backend.exception.ReferenceIndexException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link VariableCatalog} backed by the sheet service's HTTP API.
 *
 * <pre>
 *   GET {base}/api/projects/{projectId}/variables/resolve?sheet=mc.jaime&amp;variable=health
 *   GET {base}/api/projects/{projectId}/variables/{variableId}
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestVariableCatalog implements VariableCatalog {

    private final RestTemplate restTemplate;
    private final CatalogProperties properties;

    @Override
    public Optional<VariableDescriptor> resolve(UUID projectId, String sheetShortcut, String variableName) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/api/projects/{projectId}/variables/resolve")
                .queryParam("sheet", sheetShortcut)
                .queryParam("variable", variableName)
                .encode()
                .buildAndExpand(projectId)
                .toUri();
        return fetch(uri, sheetShortcut + "." + variableName);
    }

    @Override
    public Optional<VariableDescriptor> findById(UUID projectId, String variableId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/api/projects/{projectId}/variables/{variableId}")
                .encode()
                .buildAndExpand(projectId, variableId)
                .toUri();
        return fetch(uri, variableId);
    }

    private Optional<VariableDescriptor> fetch(URI uri, String what) {
        try {
            return Optional.ofNullable(restTemplate.getForObject(uri, VariableDescriptor.class));
        } catch (HttpClientErrorException.NotFound ex) {
            log.debug("Variable {} not found in catalog", what);
            return Optional.empty();
        } catch (RestClientException ex) {
            log.error("Variable catalog call failed for {}: {}", what, ex.getMessage());
            throw new ReferenceIndexException("Variable catalog unavailable while looking up " + what, ex);
        }
    }
}
