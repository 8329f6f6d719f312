package io.nodelog.core.log;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Log file names of a node grouped by {@link LogCategory}.
 *
 * Categories are ordered as declared in LogCategory. Files keep the order in
 * which they were added. Categories without files are not present.
 */
public class LogCategoryIndex
{
    public static class Builder
    {
        private final EnumMap<LogCategory, List<String>> files = new EnumMap<>(LogCategory.class);

        public Builder add(LogCategory category, String fileName)
        {
            files.computeIfAbsent(category, key -> new ArrayList<>()).add(fileName);
            return this;
        }

        public LogCategoryIndex build()
        {
            return new LogCategoryIndex(files);
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    private final Map<LogCategory, List<String>> files;

    private LogCategoryIndex(EnumMap<LogCategory, List<String>> files)
    {
        ImmutableMap.Builder<LogCategory, List<String>> builder = ImmutableMap.builder();
        for (Map.Entry<LogCategory, List<String>> pair : files.entrySet()) {
            builder.put(pair.getKey(), ImmutableList.copyOf(pair.getValue()));
        }
        this.files = builder.build();
    }

    public Set<LogCategory> getCategories()
    {
        return files.keySet();
    }

    public List<String> get(LogCategory category)
    {
        List<String> list = files.get(category);
        return list == null ? ImmutableList.of() : list;
    }

    public List<String> getAllFiles()
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (List<String> list : files.values()) {
            builder.addAll(list);
        }
        return builder.build();
    }

    public boolean isEmpty()
    {
        return files.isEmpty();
    }

    /**
     * Returns category name to file names, for JSON responses.
     */
    public Map<String, List<String>> toNameMap()
    {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (Map.Entry<LogCategory, List<String>> pair : files.entrySet()) {
            map.put(pair.getKey().getName(), pair.getValue());
        }
        return map;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (!(obj instanceof LogCategoryIndex)) {
            return false;
        }
        return files.equals(((LogCategoryIndex) obj).files);
    }

    @Override
    public int hashCode()
    {
        return files.hashCode();
    }

    @Override
    public String toString()
    {
        return toNameMap().toString();
    }
}
