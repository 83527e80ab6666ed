package com.plangraph.core.schema;

import com.plangraph.core.config.PlangraphProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Validates plan documents against the plan XSD and hands back the parsed DOM.
 * <p>
 * The schema is resolved from the classpath on first use and kept for the
 * lifetime of the validator. Parsing and validation happen in one pass, so a
 * plan file is read exactly once per build. DOCTYPE declarations and external
 * entity or schema access are refused.
 */
@Component
public class PlanSchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(PlanSchemaValidator.class);

    private final String schemaLocation;
    private Schema schema;

    @Autowired
    public PlanSchemaValidator(PlangraphProperties properties) {
        this(properties.getSchema().getLocation());
    }

    public PlanSchemaValidator(String schemaLocation) {
        this.schemaLocation = schemaLocation;
    }

    /**
     * Parse and validate a plan file.
     *
     * @param path plan document on disk
     * @return the validated DOM
     * @throws PlanBuildException with kind {@code IO_FAILURE}, {@code MALFORMED_DOCUMENT},
     *                            {@code SCHEMA_VIOLATION} or {@code SCHEMA_UNAVAILABLE}
     */
    public Document validate(Path path) throws PlanBuildException {
        DocumentBuilder builder = newDocumentBuilder(loadSchema());
        var collector = new FailureCollector();
        builder.setErrorHandler(collector);

        try (InputStream in = Files.newInputStream(path)) {
            Document document = builder.parse(in, path.toUri().toString());
            log.debug("Plan document {} passed schema validation", path);
            return document;
        } catch (NoSuchFileException e) {
            throw new PlanBuildException(PlanBuildException.Kind.IO_FAILURE,
                    "Plan file not found: " + path, e);
        } catch (IOException e) {
            throw new PlanBuildException(PlanBuildException.Kind.IO_FAILURE,
                    "Failed to read plan file " + path + ": " + e.getMessage(), e);
        } catch (SAXException e) {
            if (collector.kind == PlanBuildException.Kind.SCHEMA_VIOLATION) {
                throw new PlanBuildException(collector.kind,
                        "XML validation failed: " + describe(e), e);
            }
            throw new PlanBuildException(PlanBuildException.Kind.MALFORMED_DOCUMENT,
                    "Failed to parse XML: " + describe(e), e);
        }
    }

    /**
     * Load and cache the plan schema.
     */
    synchronized Schema loadSchema() throws PlanBuildException {
        if (schema != null) {
            return schema;
        }
        URL resource = Thread.currentThread().getContextClassLoader().getResource(schemaLocation);
        if (resource == null) {
            resource = PlanSchemaValidator.class.getClassLoader().getResource(schemaLocation);
        }
        if (resource == null) {
            throw new PlanBuildException(PlanBuildException.Kind.SCHEMA_UNAVAILABLE,
                    "Plan schema not found on classpath: " + schemaLocation);
        }
        try {
            SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            schema = factory.newSchema(resource);
            log.debug("Loaded plan schema from {}", resource);
            return schema;
        } catch (SAXException e) {
            throw new PlanBuildException(PlanBuildException.Kind.SCHEMA_UNAVAILABLE,
                    "Plan schema " + schemaLocation + " is invalid: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder(Schema schema) throws PlanBuildException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setSchema(schema);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new PlanBuildException(PlanBuildException.Kind.SCHEMA_UNAVAILABLE,
                    "XML parser cannot be configured: " + e.getMessage(), e);
        }
    }

    private static String describe(SAXException e) {
        if (e instanceof SAXParseException p && p.getLineNumber() > 0) {
            return "line " + p.getLineNumber() + ", column " + p.getColumnNumber() + ": " + p.getMessage();
        }
        return e.getMessage();
    }

    /**
     * Tells well-formedness errors (fatal) apart from schema errors (recoverable
     * in SAX terms, but fatal for a build).
     */
    private static final class FailureCollector implements ErrorHandler {

        private PlanBuildException.Kind kind = PlanBuildException.Kind.MALFORMED_DOCUMENT;

        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            kind = PlanBuildException.Kind.SCHEMA_VIOLATION;
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            kind = PlanBuildException.Kind.MALFORMED_DOCUMENT;
            throw e;
        }
    }
}
