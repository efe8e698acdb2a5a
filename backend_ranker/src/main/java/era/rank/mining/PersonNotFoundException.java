package era.rank.mining;

import era.rank.base.RankerException;

public class PersonNotFoundException extends RankerException {
    public PersonNotFoundException(String message) {
        super(message);
    }
}
