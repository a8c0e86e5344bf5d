module settings.store {
  requires transitive settings.codec;
  requires org.slf4j;

  exports settings.store;
}
