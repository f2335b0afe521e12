package org.carball.xtd.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.config.OutputFormat;
import org.carball.xtd.config.XtdConfig;
import org.carball.xtd.inference.RelationFinalizer;
import org.carball.xtd.inference.SchemaInferrer;
import org.carball.xtd.model.schema.Database;
import org.carball.xtd.model.schema.TableRelation;
import org.carball.xtd.output.DdlRenderer;
import org.carball.xtd.output.RelationReportRenderer;
import org.carball.xtd.parser.XmlNode;

import java.util.List;
import java.util.Map;

/**
 * Runs a whole conversion: infer the schema, optionally validate a second document
 * against it, flush the relations and render the requested output. Nothing is
 * rendered unless every earlier step succeeded.
 */
@Slf4j
public class SchemaAnalyzer {

    private final XtdConfig config;
    private final RelationFinalizer finalizer;
    private final DdlRenderer ddlRenderer;
    private final RelationReportRenderer relationReportRenderer;

    public SchemaAnalyzer(XtdConfig config) {
        config.validate();
        this.config = config;
        this.finalizer = RelationFinalizer.from(config);
        this.ddlRenderer = new DdlRenderer();
        this.relationReportRenderer = new RelationReportRenderer();

        log.debug("Initialized SchemaAnalyzer with config: {}", config.getConfigurationSummary());
    }

    public Database inferSchema(XmlNode document) {
        Database database = SchemaInferrer.infer(document, config.isSkipColumns());
        log.info("Inferred {} tables from <{}>", database.getTables().size(), document.tag());
        return database;
    }

    public String convert(XmlNode document) {
        return convert(document, null);
    }

    /**
     * @param validationDocument document whose schema must be storable in the schema of
     *                           {@code document}, or null to skip validation
     * @throws org.carball.xtd.error.SchemaNotSubsetException  if validation fails
     * @throws org.carball.xtd.error.NamingCollisionException  if generated names collide
     */
    public String convert(XmlNode document, XmlNode validationDocument) {
        Database database = inferSchema(document);

        if (validationDocument != null) {
            database.requireSubset(inferSchema(validationDocument));
            log.info("Validation document is storable in the inferred schema");
        }

        database.flush(finalizer);

        StringBuilder output = new StringBuilder();
        if (config.getHeader() != null) {
            output.append("--").append(config.getHeader()).append("\n\n");
        }

        if (config.getOutputFormat() == OutputFormat.RELATIONS) {
            Map<String, List<TableRelation>> relations = new CardinalityClassifier(database).classifyAll();
            output.append(relationReportRenderer.render(relations));
        } else {
            output.append(ddlRenderer.render(database));
        }
        return output.toString();
    }
}
