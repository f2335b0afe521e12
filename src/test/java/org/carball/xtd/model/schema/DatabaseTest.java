package org.carball.xtd.model.schema;

import org.carball.xtd.error.SchemaNotSubsetException;
import org.carball.xtd.inference.RelationFinalizer;
import org.carball.xtd.inference.SchemaInferrer;
import org.carball.xtd.parser.XmlDocumentParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DatabaseTest {

    private final XmlDocumentParser parser = new XmlDocumentParser();

    private Database infer(String xml) {
        return SchemaInferrer.infer(parser.parseString(xml), false);
    }

    @Test
    void shouldCreateTablesLazilyInDiscoveryOrder() {
        // Given
        Database database = new Database();

        // When
        database.updateValue("b", "text");
        database.updateAttribute("a", "x", "1");
        database.updateRelations("c", Map.of());

        // Then
        assertThat(database.getTableNames()).containsExactly("b", "a", "c");
    }

    @Test
    void shouldIgnoreAttributesWhenSkippingColumns() {
        // Given
        Database database = new Database(true);

        // When
        database.updateAttribute("person", "name", "Al");
        database.updateAttribute("person", "value", "text");

        // Then
        assertThat(database.getTables()).isEmpty();
    }

    @Test
    void shouldBuildRelationGraphOnFlush() {
        // Given
        Database database = infer("<root><person name=\"Al\"><pet/></person></root>");

        // When
        database.flush(RelationFinalizer.defaults());

        // Then
        assertThat(database.getRelationGraph()).containsOnlyKeys("person", "pet");
        assertThat(database.references("person")).containsExactly("pet");
        assertThat(database.references("pet")).isEmpty();
        assertThat(database.referencesTable("person", "pet")).isTrue();
        assertThat(database.referencesTable("pet", "person")).isFalse();
    }

    @Test
    void shouldProduceSameResultWhenFlushedTwice() {
        // Given
        Database database = infer("<root><person><pet/><pet/></person></root>");
        database.flush(RelationFinalizer.defaults());

        // When
        database.flush(RelationFinalizer.defaults());

        // Then
        assertThat(database.findTable("person").getForeignKeys()).containsExactly("pet1_id", "pet2_id");
        assertThat(database.references("person")).containsExactly("pet");
    }

    @Test
    void shouldAcceptNarrowerSchemaAsSubset() {
        // Given
        Database target = infer("<root><person name=\"Al\" age=\"5\">A long biography</person></root>");
        Database candidate = infer("<root><person name=\"Bo\">Short</person></root>");

        // Then
        assertThat(target.isSubset(candidate)).isTrue();
        assertThatCode(() -> target.requireSubset(candidate)).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectSchemaWithExtraColumns() {
        // Given
        Database target = infer("<root><person name=\"Al\" age=\"5\"/></root>");
        Database candidate = infer("<root><person name=\"Bo\"/></root>");

        // Then
        assertThat(candidate.isSubset(target)).isFalse();
        assertThatThrownBy(() -> candidate.requireSubset(target))
                .isInstanceOf(SchemaNotSubsetException.class)
                .hasMessageContaining("person.age");
    }

    @Test
    void shouldRejectWiderColumnType() {
        // Given
        Database target = infer("<root><person age=\"5\"/></root>");
        Database candidate = infer("<root><person age=\"5.5\"/></root>");

        // Then
        assertThat(target.isSubset(candidate)).isFalse();
        assertThat(candidate.isSubset(target)).isTrue();
    }

    @Test
    void shouldRejectNtextValueInNarrowerValue() {
        // Given
        Database target = infer("<root><note>42</note></root>");
        Database candidate = infer("<root><note>forty two</note></root>");

        // Then
        assertThat(target.isSubset(candidate)).isFalse();
        assertThat(candidate.isSubset(target)).isTrue();
    }

    @Test
    void shouldRejectValueWhereTargetHasNone() {
        // Given
        Database target = infer("<root><note id=\"1\"/></root>");
        Database candidate = infer("<root><note id=\"1\">text</note></root>");

        // Then
        assertThat(target.isSubset(candidate)).isFalse();
        assertThat(candidate.isSubset(target)).isTrue();
    }

    @Test
    void shouldRejectUnknownTable() {
        // Given
        Database target = infer("<root><person/></root>");
        Database candidate = infer("<root><person/><pet/></root>");

        // Then
        assertThatThrownBy(() -> target.requireSubset(candidate))
                .isInstanceOf(SchemaNotSubsetException.class)
                .hasMessageContaining("'pet'");
    }
}
