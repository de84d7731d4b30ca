package com.herzen.tutor.moderation;

import com.herzen.tutor.domain.DomainModels.FlaggedItem;

public interface SafetyAlertListener {
    void onFlag(FlaggedItem flag, String messagePreview);
}
