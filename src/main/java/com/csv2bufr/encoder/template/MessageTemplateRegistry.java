package com.csv2bufr.encoder.template;

import com.csv2bufr.encoder.NativeType;
import com.csv2bufr.exception.EncoderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads message templates from {@code templates/<NAME>.json} on the classpath, or from explicitly
 * registered files, and caches them by name.
 */
public class MessageTemplateRegistry {
    private static final Logger log = LoggerFactory.getLogger(MessageTemplateRegistry.class);

    static final String TEMPLATE_RESOURCE_DIR = "templates/";

    private final ObjectMapper objectMapper;
    private final Map<String, MessageTemplate> templates = new ConcurrentHashMap<>();

    public MessageTemplateRegistry() {
        this(new ObjectMapper());
    }

    public MessageTemplateRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(MessageTemplate template) {
        templates.put(template.getName(), template);
    }

    public MessageTemplate register(Path templateFile) throws IOException {
        MessageTemplate template = fromJson(objectMapper.readTree(Files.readString(templateFile)));
        register(template);
        log.debug("Registered template {} from {}", template.getName(), templateFile);
        return template;
    }

    public MessageTemplate get(String name) {
        return templates.computeIfAbsent(name, this::loadResource);
    }

    private MessageTemplate loadResource(String name) {
        String resource = TEMPLATE_RESOURCE_DIR + name + ".json";
        try (InputStream in = MessageTemplateRegistry.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new EncoderException("unknown message template: " + name);
            }
            MessageTemplate template = fromJson(objectMapper.readTree(in));
            log.debug("Loaded template {} with {} elements", template.getName(), template.getElements().size());
            return template;
        } catch (IOException e) {
            throw new EncoderException(null, null, "failed to read template resource " + resource, e);
        }
    }

    static MessageTemplate fromJson(JsonNode node) {
        if (!node.hasNonNull("name") || !node.path("elements").isObject()) {
            throw new EncoderException("template must define 'name' and an 'elements' object");
        }
        MessageTemplate.MessageTemplateBuilder builder = MessageTemplate.builder()
                .name(node.get("name").asText())
                .edition(node.path("edition").asInt(4))
                .masterTableNumber(node.path("masterTableNumber").asInt(0));

        Iterator<Map.Entry<String, JsonNode>> elements = node.get("elements").fields();
        while (elements.hasNext()) {
            Map.Entry<String, JsonNode> element = elements.next();
            builder.element(element.getKey(), NativeType.fromName(element.getValue().asText()));
        }
        return builder.build();
    }
}
