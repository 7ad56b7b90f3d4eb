/*
 * Mimir - CRM Backup and Restore
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.mimir.schema;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of every CRM entity type, in dependency order (parents before children).
 * Export and merge both walk {@link #entities()} in this order.
 */
@Component
public class CrmSchema {

    private final List<EntityDescriptor> entities;
    private final Map<String, EntityDescriptor> byName;
    private final List<ReferenceLink> referenceLinks;

    public CrmSchema() {
        this(defaultEntities(), defaultReferenceLinks());
    }

    public CrmSchema(List<EntityDescriptor> entities, List<ReferenceLink> referenceLinks) {
        this.entities = List.copyOf(entities);
        Map<String, EntityDescriptor> map = new LinkedHashMap<>();
        for (EntityDescriptor d : this.entities) {
            if (map.put(d.getName(), d) != null) {
                throw new IllegalArgumentException("Duplicate entity type: " + d.getName());
            }
        }
        this.byName = Collections.unmodifiableMap(map);
        for (ReferenceLink link : referenceLinks) {
            require(link.entity()).requireColumn(link.field());
        }
        this.referenceLinks = List.copyOf(referenceLinks);
    }

    public List<EntityDescriptor> entities() {
        return entities;
    }

    public Optional<EntityDescriptor> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public EntityDescriptor require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + name));
    }

    public List<ReferenceLink> referenceLinks() {
        return referenceLinks;
    }

    private static List<EntityDescriptor> defaultEntities() {
        return List.of(
                EntityDescriptor.builder("systemSettings", "system_settings")
                        .column("key", "setting_key", ColumnType.STRING)
                        .string("category")
                        .column("value", "setting_value", ColumnType.JSON)
                        .string("updatedBy")
                        .timestamp("createdAt")
                        .updatedAt()
                        .build(),
                EntityDescriptor.builder("pipelineStages", "pipeline_stages")
                        .string("name", "color")
                        .integer("position")
                        .bool("isActive")
                        .timestamp("createdAt")
                        .updatedAt()
                        .build(),
                EntityDescriptor.builder("formTemplates", "form_templates")
                        .string("name", "description")
                        .json("fields")
                        .timestamp("createdAt")
                        .updatedAt()
                        .build(),
                // teams reference users, so users.teamId is filled in after teams are merged
                EntityDescriptor.builder("users", "users")
                        .string("email", "name", "role", "passwordHash")
                        .bool("isActive")
                        .forwardReference("teamId")
                        .selfReference("accountManagerId")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("teams", "teams")
                        .string("name", "teamLeaderUserId")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("campaigns", "campaigns")
                        .string("name", "description", "clientId", "qcUserId", "formTemplateId")
                        .bool("isActive")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("campaignTeams", "campaign_teams")
                        .string("campaignId", "teamId")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("campaignQCs", "campaign_qcs")
                        .string("campaignId", "userId")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("leads", "leads")
                        .string("serialNumber", "campaignId", "agentId", "qcUserId", "pipelineStageId",
                                "status", "customerName", "phone", "email")
                        .decimal("dealValue")
                        .json("customFields")
                        .timestamp("createdAt")
                        .updatedAt()
                        .build(),
                EntityDescriptor.builder("leadNotes", "lead_notes")
                        .string("leadId", "userId", "content")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("leadAudits", "lead_audits")
                        .string("leadId", "userId", "event", "oldValue", "newValue")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("clientNotes", "client_notes")
                        .string("leadId", "clientId", "content")
                        .timestamp("createdAt")
                        .updatedAt()
                        .build(),
                EntityDescriptor.builder("clientSchedules", "client_schedules")
                        .string("leadId", "clientId", "title", "notes")
                        .timestamp("scheduledAt", "createdAt")
                        .updatedAt()
                        .build(),
                EntityDescriptor.builder("leaveRequests", "leave_requests")
                        .string("userId", "managerId", "reason", "status")
                        .timestamp("startDate", "endDate", "createdAt")
                        .build(),
                EntityDescriptor.builder("itTickets", "it_tickets")
                        .string("title", "description", "priority", "status", "submittedById", "assignedITId")
                        .timestamp("createdAt")
                        .updatedAt()
                        .build(),
                EntityDescriptor.builder("itTicketResponses", "it_ticket_responses")
                        .string("ticketId", "userId", "message")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("itTicketStatusHistory", "it_ticket_status_history")
                        .string("ticketId", "oldStatus", "newStatus", "changedById")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("itAssignments", "it_assignments")
                        .string("userId", "assignedById")
                        .bool("isActive")
                        .timestamp("createdAt")
                        .build(),
                EntityDescriptor.builder("loginHistory", "login_history")
                        .string("userId", "ipAddress")
                        .timestamp("loginAt", "logoutAt")
                        .build(),
                EntityDescriptor.builder("dailyTopAgents", "daily_top_agents")
                        .string("userId")
                        .timestamp("recordedFor")
                        .integer("leadCount")
                        .timestamp("createdAt")
                        .build()
        );
    }

    private static List<ReferenceLink> defaultReferenceLinks() {
        return List.of(
                new ReferenceLink("users", "teamId"),
                new ReferenceLink("users", "accountManagerId"),
                new ReferenceLink("teams", "teamLeaderUserId"),
                new ReferenceLink("campaigns", "clientId"),
                new ReferenceLink("campaigns", "qcUserId"),
                new ReferenceLink("campaigns", "formTemplateId"),
                new ReferenceLink("leads", "campaignId"),
                new ReferenceLink("leads", "qcUserId"),
                new ReferenceLink("leaveRequests", "managerId"),
                new ReferenceLink("itTickets", "assignedITId")
        );
    }
}
