package com.rebenew.listeningRooms.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Vista derivada y cacheada de una sala: participantes, cola y reproducción.
 * Es válida mientras {@link #getVersion()} coincida con la versión actual de la sala.
 */
@Getter
public class RoomStateSnapshot implements EventSubject {
    private final String roomId;
    private final String name;
    private final String ownerId;
    private final RoomState state;
    private final List<Participant> participants;
    private final int participantCount;
    private final List<TrackEntry> queue;
    private final int trackCount;
    private final PlaybackState playback;
    private final Instant createdAt;
    private final long version;
    private final Instant computedAt;

    public RoomStateSnapshot(Room room, RoomState state, List<Participant> participants, long version,
            List<TrackEntry> queue, PlaybackState playback, Instant computedAt) {
        this.roomId = room.getRoomId();
        this.name = room.getName();
        this.ownerId = room.getOwnerId();
        this.state = state;
        this.participants = List.copyOf(participants);
        this.participantCount = participants.size();
        this.queue = queue != null ? List.copyOf(queue) : List.of();
        this.trackCount = this.queue.size();
        this.playback = playback != null ? playback : PlaybackState.idle();
        this.createdAt = room.getCreatedAt();
        this.version = version;
        this.computedAt = computedAt;
    }

    public boolean isCurrentFor(long roomVersion) {
        return version == roomVersion;
    }

    public boolean isOlderThan(Duration ttl, Instant now) {
        return computedAt.plus(ttl).isBefore(now);
    }

    @JsonIgnore
    @Override
    public String getId() {
        return roomId;
    }

    @Override
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("roomId", roomId);
        summary.put("name", name);
        summary.put("ownerId", ownerId);
        summary.put("state", state);
        summary.put("participants", participants.stream().map(Participant::toSummary).collect(Collectors.toList()));
        summary.put("participantCount", participantCount);
        summary.put("queue", queue.stream().map(TrackEntry::toSummary).collect(Collectors.toList()));
        summary.put("trackCount", trackCount);
        summary.put("playback", playback.toSummary(computedAt.toEpochMilli()));
        summary.put("createdAt", createdAt.toEpochMilli());
        summary.put("serverTime", computedAt.toEpochMilli());
        return summary;
    }
}
