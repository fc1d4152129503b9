package com.yunhwan.eventstore.usecase.events;

import com.yunhwan.eventstore.domain.event.Event;
import com.yunhwan.eventstore.domain.stream.Stream;
import com.yunhwan.eventstore.domain.stream.StreamId;
import com.yunhwan.eventstore.usecase.events.dto.EventToAdd;
import com.yunhwan.eventstore.usecase.events.dto.StreamToCreate;

import java.util.List;

/**
 * 스트림 생성/조회와 낙관적 동시성 제어 하의 이벤트 append.
 * 여러 스레드에서 동시에 호출해도 안전하다. 상호 배제는 전부 DB(row lock, 유니크 제약)에 맡긴다.
 */
public interface EventStore {

    Stream getStream(StreamId streamId);

    Stream createStream(StreamToCreate streamToCreate);

    List<Event> getEvents(StreamId streamId);

    Event addEventToStream(EventToAdd eventToAdd);
}
