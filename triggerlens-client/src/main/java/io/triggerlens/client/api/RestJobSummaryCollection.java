package io.triggerlens.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableRestJobSummaryCollection.class)
@JsonDeserialize(as = ImmutableRestJobSummaryCollection.class)
public interface RestJobSummaryCollection
{
    List<RestJobSummary> getJobs();

    static RestJobSummaryCollection of(Iterable<? extends RestJobSummary> jobs)
    {
        return ImmutableRestJobSummaryCollection.builder()
            .addAllJobs(jobs)
            .build();
    }
}
