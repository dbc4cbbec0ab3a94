package logsink;

import java.util.List;

final class MemorySinkHandle extends SinkHandle<MemorySink> {

  MemorySinkHandle(HandleContext<MemorySink> context) {
    super(context);
  }

  List<String> lines() {
    return call(sink -> List.copyOf(sink.lines));
  }

  void setFailing(boolean failing) {
    run(sink -> sink.failing = failing);
  }
}
