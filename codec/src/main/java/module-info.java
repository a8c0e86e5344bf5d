module settings.codec {
  requires org.apache.commons.lang3;
  requires com.machinezoo.noexception;
  requires transitive org.jspecify;
  requires org.slf4j;

  exports settings.codec;
}
