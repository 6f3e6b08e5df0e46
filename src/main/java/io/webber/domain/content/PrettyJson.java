package io.webber.domain.content;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Renders JSON documents in the layout click tooling writes: four-space indentation, one value per
 * line, {@code ": "} between names and values, and a trailing newline.
 *
 * @since 0.1.0
 */
final class PrettyJson {
  private static final JsonFactory FACTORY = new JsonFactory();

  private PrettyJson() {}

  /** Writes the document produced by {@code body} and returns it as text. */
  static String render(Body body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.setPrettyPrinter(new ClickPrettyPrinter());
      body.write(gen);
    } catch (IOException ex) {
      // StringWriter does not fail; a generator error here is a programming mistake.
      throw new UncheckedIOException("Unable to render JSON document", ex);
    }
    return out.append('\n').toString();
  }

  @FunctionalInterface
  interface Body {
    void write(JsonGenerator gen) throws IOException;
  }

  private static final class ClickPrettyPrinter extends DefaultPrettyPrinter {
    private static final long serialVersionUID = 1L;
    private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");

    ClickPrettyPrinter() {
      _objectIndenter = INDENTER;
      _arrayIndenter = INDENTER;
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
      return new ClickPrettyPrinter();
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }
  }
}
