package com.apiflow.service.impl;

import com.apiflow.config.EngineProperties;
import com.apiflow.engine.TypeGraphWalker;
import com.apiflow.model.Credential;
import com.apiflow.model.InterfaceDocument;
import com.apiflow.model.SchemaField;
import com.apiflow.model.TypeReference;
import com.apiflow.service.api.CredentialProvider;
import com.apiflow.service.api.InterfaceDocumentService;
import com.apiflow.service.api.SchemaService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SchemaServiceImpl implements SchemaService {

    private final InterfaceDocumentService documentService;
    private final CredentialProvider credentialProvider;
    private final EngineProperties properties;

    public SchemaServiceImpl(InterfaceDocumentService documentService, CredentialProvider credentialProvider, EngineProperties properties) {
        this.documentService = documentService;
        this.credentialProvider = credentialProvider;
        this.properties = properties;
    }

    @Override
    public List<SchemaField> resourceSchema(TypeReference reference) {
        return walker(reference).resourceSchema(reference.getName());
    }

    @Override
    public ObjectNode resourceJson(TypeReference reference) {
        return walker(reference).resourceJson(reference.getName());
    }

    @Override
    public String resourceStruct(TypeReference reference) {
        return walker(reference).resourceStruct(reference.getName());
    }

    @Override
    public List<SchemaField> methodSchema(TypeReference reference, boolean iterate) {
        return walker(reference).methodSchema(reference.getName(), iterate);
    }

    private TypeGraphWalker walker(TypeReference reference) {
        Credential credential = credentialProvider.getCredential(reference.getAuth());
        String version = reference.getVersion();
        if (version == null || version.isBlank()) {
            version = documentService.preferredVersion(reference.getServiceId(), reference.getKey());
        }
        log.debug("Translating {} of {} {}", reference.getName(), reference.getServiceId(), version);
        InterfaceDocument document = documentService.getDocument(reference.getServiceId(), version, reference.getAuth(),
                credential, reference.getKey(), reference.getLabels(), reference.getDocumentSource());
        EngineProperties.SchemaConfig schema = properties.getSchema();
        return new TypeGraphWalker(document, schema.getRecursionDepth(), schema.getDescriptionLength());
    }
}
