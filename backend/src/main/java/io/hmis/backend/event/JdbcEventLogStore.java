package io.hmis.backend.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Streams stored as rows of {@code public.event_log}. The insert and the trim to the cap run in one
 * transaction, so a reader never sees the stream above its cap.
 */
@Repository
@ConditionalOnProperty(name = "hmis.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcEventLogStore implements EventLogStore {

  private static final TypeReference<Map<String, String>> FIELDS_TYPE = new TypeReference<>() {};

  private final JdbcClient jdbc;
  private final TransactionTemplate transactionTemplate;
  private final ObjectMapper objectMapper;

  public JdbcEventLogStore(
      @Qualifier("appDataSource") DataSource dataSource, ObjectMapper objectMapper) {
    this.jdbc = JdbcClient.create(dataSource);
    this.transactionTemplate =
        new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    this.objectMapper = objectMapper;
  }

  @Override
  public String append(String stream, Map<String, String> fields, int maxLength) {
    String json = writeFields(fields);
    Long id =
        transactionTemplate.execute(
            status -> {
              Long inserted =
                  jdbc.sql(
                          """
                          INSERT INTO public.event_log (stream, fields, appended_at)
                          VALUES (?, CAST(? AS jsonb), now())
                          RETURNING id
                          """)
                      .params(stream, json)
                      .query(Long.class)
                      .single();
              jdbc.sql(
                      """
                      DELETE FROM public.event_log
                      WHERE stream = :stream
                        AND id <= (SELECT id FROM public.event_log
                                   WHERE stream = :stream
                                   ORDER BY id DESC
                                   LIMIT 1 OFFSET :cap)
                      """)
                  .param("stream", stream)
                  .param("cap", maxLength)
                  .update();
              return inserted;
            });
    return String.valueOf(id);
  }

  @Override
  public long length(String stream) {
    return jdbc.sql("SELECT count(*) FROM public.event_log WHERE stream = ?")
        .param(stream)
        .query(Long.class)
        .single();
  }

  @Override
  public boolean exists(String stream) {
    return jdbc.sql("SELECT EXISTS (SELECT 1 FROM public.event_log WHERE stream = ?)")
        .param(stream)
        .query(Boolean.class)
        .single();
  }

  @Override
  public List<EventLogEntry> latest(String stream, int count) {
    return jdbc.sql(
            """
            SELECT id, stream, fields::text AS fields, appended_at
            FROM public.event_log
            WHERE stream = ?
            ORDER BY id DESC
            LIMIT ?
            """)
        .params(stream, count)
        .query(this::mapEntry)
        .list();
  }

  private EventLogEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
    return new EventLogEntry(
        String.valueOf(rs.getLong("id")),
        rs.getString("stream"),
        readFields(rs.getString("fields")),
        rs.getTimestamp("appended_at").toInstant());
  }

  private String writeFields(Map<String, String> fields) {
    try {
      return objectMapper.writeValueAsString(fields);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Event log fields are not serializable", e);
    }
  }

  private Map<String, String> readFields(String json) {
    try {
      return objectMapper.readValue(json, FIELDS_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt event log entry", e);
    }
  }
}
