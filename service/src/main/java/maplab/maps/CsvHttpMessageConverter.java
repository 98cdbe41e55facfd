package maplab.maps;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes collections as {@code text/csv} with a header row. Rows given as maps take their columns
 * from the keys in first-seen order; other rows use the bean schema of their class.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV request bodies are not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    CsvMapper mapper = new CsvMapper();
    // the servlet container owns the response stream
    mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    try (SequenceWriter writer = mapper.writer(schemaFor(mapper, rows))
        .writeValues(outputMessage.getBody())) {
      for (Object row : rows) {
        writer.write(row);
      }
    }
  }

  private static CsvSchema schemaFor(CsvMapper mapper, Collection<?> rows) {
    Object sample = rows.stream().filter(row -> row != null).findFirst().orElse(null);
    if (sample instanceof Map<?, ?>) {
      Set<String> columns = new LinkedHashSet<>();
      for (Object row : rows) {
        if (row instanceof Map<?, ?> map) {
          map.keySet().forEach(key -> columns.add(String.valueOf(key)));
        }
      }
      CsvSchema.Builder builder = CsvSchema.builder();
      columns.forEach(builder::addColumn);
      return builder.setUseHeader(true).build();
    }
    if (sample == null) {
      return CsvSchema.emptySchema();
    }
    return mapper.schemaFor(sample.getClass()).withHeader();
  }
}
