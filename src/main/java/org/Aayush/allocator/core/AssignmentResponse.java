package org.Aayush.allocator.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.allocator.assign.Assignment;

import java.util.List;

@Value
@Builder
public class AssignmentResponse {
    /** One assignment per point, in point input order. */
    List<Assignment> assignments;
    InvocationMetadata metadata;
}
