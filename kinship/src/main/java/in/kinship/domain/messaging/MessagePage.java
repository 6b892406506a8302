package in.kinship.domain.messaging;

import java.util.List;

/**
 * One page of a conversation's history. {@code nextCursor} is null on the last page.
 */
public record MessagePage(
    List<Message> data,
    String nextCursor
) {
    public MessagePage {
        data = List.copyOf(data);
    }
}
