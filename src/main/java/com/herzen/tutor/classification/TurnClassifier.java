package com.herzen.tutor.classification;

import com.herzen.tutor.domain.DomainModels.Labels;
import com.herzen.tutor.domain.DomainModels.TurnRole;

public interface TurnClassifier {
    Labels classify(String text, TurnRole role);
}
