package io.nodelog.client.api;

import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableRestLogCategoryIndex.class)
@JsonDeserialize(as = ImmutableRestLogCategoryIndex.class)
public interface RestLogCategoryIndex
{
    String getNodeId();

    // category name -> file names, in category order
    Map<String, List<String>> getCategories();

    static ImmutableRestLogCategoryIndex.Builder builder()
    {
        return ImmutableRestLogCategoryIndex.builder();
    }
}
