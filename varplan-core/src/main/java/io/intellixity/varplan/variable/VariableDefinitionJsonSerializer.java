package io.intellixity.varplan.variable;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link VariableDefinition}. Writes camelCase keys and omits defaults. */
public final class VariableDefinitionJsonSerializer extends JsonSerializer<VariableDefinition> {
  @Override
  public void serialize(VariableDefinition v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("kind", v.kind().wireKind());
    g.writeObjectFieldStart("spec");
    g.writeStringField("name", v.name());
    writeDisplay(v.spec().display(), g);

    if (v.spec() instanceof TextVariableSpec t) {
      if (t.value() != null) g.writeStringField("value", t.value());
      if (t.constant()) g.writeBooleanField("constant", true);
    } else if (v.spec() instanceof ListVariableSpec l) {
      if (l.defaultValue() != null) g.writeObjectField("defaultValue", l.defaultValue());
      if (l.allowAllValue()) g.writeBooleanField("allowAllValue", true);
      if (l.allowMultiple()) g.writeBooleanField("allowMultiple", true);
      if (l.customAllValue() != null) g.writeStringField("customAllValue", l.customAllValue());
      if (l.capturingRegexp() != null) g.writeStringField("capturingRegexp", l.capturingRegexp());
      if (l.sort() != null) g.writeStringField("sort", l.sort());
      g.writeObjectFieldStart("plugin");
      g.writeStringField("kind", l.plugin().kind());
      g.writeObjectField("spec", l.plugin().spec());
      g.writeEndObject();
    }

    g.writeEndObject();
    g.writeEndObject();
  }

  private static void writeDisplay(Display d, JsonGenerator g) throws IOException {
    if (d == null) return;
    g.writeObjectFieldStart("display");
    if (d.name() != null) g.writeStringField("name", d.name());
    if (d.description() != null) g.writeStringField("description", d.description());
    if (d.hidden()) g.writeBooleanField("hidden", true);
    g.writeEndObject();
  }
}
