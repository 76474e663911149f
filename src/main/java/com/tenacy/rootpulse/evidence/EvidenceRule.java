package com.tenacy.rootpulse.evidence;

import java.util.Optional;

public interface EvidenceRule {
    String getRuleId();
    int getPriority();
    Optional<ParsedEvidence> apply(String evidenceText);
}
