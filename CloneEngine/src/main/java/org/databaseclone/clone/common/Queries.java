package org.databaseclone.clone.common;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

/**
 * Builds the JSON encoded {@code queries[]} parameters the service accepts on listing calls,
 * e.g. {@code {"method":"limit","values":[100]}}.
 */
@UtilityClass
public class Queries {
    private static final ObjectMapper objectMapper = ObjectMapperFactory.createDefaultMapper();
    private static final String QUERY_PARAM = URLEncoder.encode("queries[]", StandardCharsets.UTF_8);

    public static String limit(int limit) {
        var query = query("limit");
        query.putArray("values").add(limit);
        return write(query);
    }

    public static String cursorAfter(String key) {
        var query = query("cursorAfter");
        query.putArray("values").add(key);
        return write(query);
    }

    public static List<String> forPage(PageRequest page) {
        var queries = new ArrayList<String>();
        queries.add(limit(page.limit()));
        if (page.hasCursor()) {
            queries.add(cursorAfter(page.cursorAfter()));
        }
        return queries;
    }

    /** Query string for a page, without the leading question mark. */
    public static String toQueryString(PageRequest page) {
        var sb = new StringBuilder();
        for (var query : forPage(page)) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(QUERY_PARAM).append('=').append(URLEncoder.encode(query, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    private static ObjectNode query(String method) {
        var query = objectMapper.createObjectNode();
        query.put("method", method);
        return query;
    }

    private static String write(ObjectNode query) {
        try {
            return objectMapper.writeValueAsString(query);
        } catch (JsonProcessingException e) {
            throw new CloneException("Unable to encode query " + query, e);
        }
    }
}
