package org.carball.xtd.output;

import org.carball.xtd.inference.RelationFinalizer;
import org.carball.xtd.inference.SchemaInferrer;
import org.carball.xtd.model.schema.Database;
import org.carball.xtd.parser.XmlDocumentParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DdlRendererTest {

    private final XmlDocumentParser parser = new XmlDocumentParser();
    private final DdlRenderer renderer = new DdlRenderer();

    private String render(String xml) {
        Database database = SchemaInferrer.infer(parser.parseString(xml), false);
        database.flush(RelationFinalizer.defaults());
        return renderer.render(database);
    }

    @Test
    void shouldRenderKeysBeforeAttributeColumns() {
        // When
        String ddl = render("<root><person name=\"Al\" age=\"5\"><pet name=\"Rex\"/></person></root>");

        // Then
        assertThat(ddl).isEqualTo("""
                CREATE TABLE person(
                   prk_person_id INT PRIMARY KEY,
                   pet_id INT,
                   name NVARCHAR,
                   age INT
                );

                CREATE TABLE pet(
                   prk_pet_id INT PRIMARY KEY,
                   name NVARCHAR
                );

                """);
    }

    @Test
    void shouldRenderValueColumnLast() {
        // When
        String ddl = render("<root><note id=\"1\">Remember the milk</note></root>");

        // Then
        assertThat(ddl).isEqualTo("""
                CREATE TABLE note(
                   prk_note_id INT PRIMARY KEY,
                   id BIT,
                   value NTEXT
                );

                """);
    }

    @Test
    void shouldRenderTableWithPrimaryKeyOnly() {
        assertThat(render("<root><empty/></root>")).isEqualTo("""
                CREATE TABLE empty(
                   prk_empty_id INT PRIMARY KEY
                );

                """);
    }

    @Test
    void shouldRenderNothingForEmptyDatabase() {
        assertThat(renderer.render(new Database())).isEmpty();
    }
}
