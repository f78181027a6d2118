package com.parlayarchitect.intake;

import com.parlayarchitect.domain.model.Leg;
import java.util.List;
import lombok.Value;

/**
 * Output of the intake boundary: the legs that parsed cleanly plus everything quarantined.
 *
 * <p>{@code totalRecords == legs.size() + malformed.size()} always holds.
 */
@Value
public class IntakeResult {

    List<Leg> legs;
    List<MalformedRecord> malformed;

    public IntakeResult(List<Leg> legs, List<MalformedRecord> malformed) {
        this.legs = List.copyOf(legs);
        this.malformed = List.copyOf(malformed);
    }

    public int getTotalRecords() {
        return legs.size() + malformed.size();
    }

    public int getMalformedCount() {
        return malformed.size();
    }
}
