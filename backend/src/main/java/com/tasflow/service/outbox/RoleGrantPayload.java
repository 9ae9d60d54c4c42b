package com.tasflow.service.outbox;

import java.util.List;

public record RoleGrantPayload(List<Long> authorIds, String publicationTitle) {}
