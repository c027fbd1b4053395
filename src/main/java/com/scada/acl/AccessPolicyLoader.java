package com.scada.acl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scada.config.ConfigurationException;
import com.scada.topic.TopicContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Загружает политику доступа из JSON.
 * <pre>
 * {
 *   "principals": {
 *     "api-service": [
 *       {"direction": "read",  "pattern": "%ns%/data/+"},
 *       {"direction": "write", "pattern": "%ns%/data/+/confirmation"}
 *     ]
 *   }
 * }
 * </pre>
 * {@code %ns%} заменяется на пространство имён топиков. Политика — данные:
 * изменение прав не требует пересборки.
 */
public class AccessPolicyLoader {

  private static final Logger logger = LoggerFactory.getLogger(AccessPolicyLoader.class);

  static final String CLASSPATH_PREFIX = "classpath:";

  record GrantEntry(@JsonProperty("direction") String direction, @JsonProperty("pattern") String pattern) {
  }

  record PolicyDocument(@JsonProperty("principals") Map<String, List<GrantEntry>> principals) {
  }

  private final ObjectMapper objectMapper;
  private final TopicContract contract;

  public AccessPolicyLoader(TopicContract contract) {
    this.contract = contract;
    this.objectMapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * @param location "classpath:acl-policy.json" или путь к файлу.
   * @throws ConfigurationException если файл не найден, не разбирается или содержит некорректные права.
   */
  public AccessPolicy load(String location) {
    try (InputStream input = open(location)) {
      AccessPolicy policy = parse(input);
      logger.info("Политика доступа загружена из '{}': {} принципалов", location, policy.principals().size());
      return policy;
    } catch (IOException e) {
      throw new ConfigurationException("Не удалось прочитать политику доступа '" + location + "': " + e.getMessage());
    }
  }

  AccessPolicy parse(InputStream input) throws IOException {
    PolicyDocument document = objectMapper.readValue(input, PolicyDocument.class);
    if (document == null || document.principals() == null || document.principals().isEmpty()) {
      throw new ConfigurationException("Политика доступа не содержит ни одного принципала");
    }
    List<String> problems = new ArrayList<>();
    Map<String, List<Grant>> grants = new LinkedHashMap<>();
    document.principals().forEach((principal, entries) -> {
      List<Grant> list = new ArrayList<>();
      if (entries != null) {
        for (GrantEntry entry : entries) {
          try {
            list.add(new Grant(Direction.parse(entry.direction()), contract.resolve(entry.pattern())));
          } catch (IllegalArgumentException | NullPointerException e) {
            problems.add("принципал '" + principal + "': " + e.getMessage());
          }
        }
      }
      grants.put(principal, list);
    });
    if (!problems.isEmpty()) {
      throw new ConfigurationException(problems);
    }
    return new AccessPolicy(grants);
  }

  private InputStream open(String location) throws IOException {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      InputStream input = AccessPolicyLoader.class.getClassLoader().getResourceAsStream(resource);
      if (input == null) {
        throw new ConfigurationException("Файл политики доступа '" + resource + "' не найден в classpath.");
      }
      return input;
    }
    return Files.newInputStream(Path.of(location));
  }
}
