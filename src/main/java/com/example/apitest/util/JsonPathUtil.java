package com.example.apitest.util;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.spi.json.JacksonJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@UtilityClass
public class JsonPathUtil {

    private static final Configuration SEARCH_CONFIG =
            Configuration.builder()
                    .jsonProvider(new JacksonJsonProvider())
                    .mappingProvider(new JacksonMappingProvider())
                    .options(Option.ALWAYS_RETURN_LIST, Option.SUPPRESS_EXCEPTIONS)
                    .build();

    /**
     * Returns every match of {@code path} inside an already parsed document (maps, lists, scalars).
     *
     * @throws IllegalArgumentException when the expression does not compile
     */
    public static List<Object> search(Object document, String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("JSONPath expression is required");
        }
        JsonPath compiled;
        try {
            compiled = JsonPath.compile(path.trim());
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid jsonpath expression: " + path, e);
        }
        if (document == null) {
            return List.of();
        }
        Object result = JsonPath.using(SEARCH_CONFIG).parse(document).read(compiled);
        if (result instanceof Collection) {
            return new ArrayList<>((Collection<?>) result);
        }
        List<Object> single = new ArrayList<>();
        if (result != null) {
            single.add(result);
        }
        return single;
    }

    /**
     * Like {@link #search} but collapses the matches: none gives null, one gives the match itself,
     * several give the list.
     */
    public static Object evaluate(Object document, String path) {
        List<Object> matches = search(document, path);
        if (matches.isEmpty()) {
            return null;
        }
        return matches.size() == 1 ? matches.get(0) : matches;
    }
}
