package com.parlayarchitect.mapper;

import com.parlayarchitect.config.ArchitectProperties;
import com.parlayarchitect.domain.model.RuleSet;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from bound profile properties to the immutable {@link RuleSet}.
 *
 * <p>Field names line up one-to-one; the boxed minimum weight is unboxed after the loader has
 * checked it for null.
 */
@Mapper
public interface RuleSetMapper {

    RuleSet toRuleSet(ArchitectProperties.ProfileProperties profileProperties);
}
